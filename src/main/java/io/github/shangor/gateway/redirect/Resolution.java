package io.github.shangor.gateway.redirect;

import io.github.shangor.gateway.upstream.FetchResult;

import java.net.URI;

/**
 * Outcome of following a redirect chain.
 *
 * @param response the last answer fetched, served to the visitor
 * @param finalUrl the URL that produced {@code response}
 * @param fetches  upstream fetches the resolver issued
 */
public record Resolution(FetchResult response, URI finalUrl, int fetches, Termination termination) {

    public enum Termination {
        /** a page that does not forward anywhere */
        FINAL,
        /** the hop cap was reached; {@code response} is the last hop fetched */
        HOP_LIMIT,
        /** a redirect notice no strategy could read; returned as is */
        UNRESOLVED_INTERSTITIAL,
        /** the chain pointed at an internal address and was not followed */
        BLOCKED_TARGET
    }
}
