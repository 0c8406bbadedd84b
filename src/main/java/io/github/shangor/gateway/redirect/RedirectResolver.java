package io.github.shangor.gateway.redirect;

import io.github.shangor.gateway.security.TargetGuard;
import io.github.shangor.gateway.session.VisitorSession;
import io.github.shangor.gateway.upstream.FetchOptions;
import io.github.shangor.gateway.upstream.FetchResult;
import io.github.shangor.gateway.upstream.UpstreamFetcher;
import io.github.shangor.gateway.util.Urls;
import io.netty.handler.codec.http.HttpMethod;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Collapses HTTP, meta-refresh, script and redirect-notice hops on the server
 * so the browser only ever sees the last page, fetched through the visitor's
 * upstream identity. Every answer examined counts as one hop; reaching the cap
 * returns the last answer instead of failing.
 */
public class RedirectResolver {
    private static final Logger log = LoggerFactory.getLogger(RedirectResolver.class);

    private static final List<DestinationStrategy> NOTICE_STRATEGIES = List.of(DestinationStrategy.values());

    private final UpstreamFetcher fetcher;
    private final InterstitialDetector detector;
    private final TargetGuard guard;
    private final int maxHops;

    public RedirectResolver(UpstreamFetcher fetcher, InterstitialDetector detector, TargetGuard guard, int maxHops) {
        this.fetcher = fetcher;
        this.detector = detector;
        this.guard = guard;
        this.maxHops = maxHops;
    }

    public CompletableFuture<Resolution> resolve(URI start, VisitorSession session, FetchOptions options) {
        FetchOptions manual = options.withFollowRedirects(false);
        return fetcher.fetchWithRetry(start, session, manual)
                .thenCompose(first -> step(first, 1, 1, session, manual));
    }

    /**
     * Continues from an answer the caller already fetched, which counts as the first hop.
     */
    public CompletableFuture<Resolution> resolveFrom(FetchResult first, VisitorSession session, FetchOptions options) {
        return step(first, 1, 0, session, options.withFollowRedirects(false));
    }

    private CompletableFuture<Resolution> step(FetchResult current, int hops, int fetches, VisitorSession session,
                                               FetchOptions options) {
        Hop hop = nextHop(current);
        if (hop.next().isEmpty()) {
            if (hop.termination() == Resolution.Termination.UNRESOLVED_INTERSTITIAL) {
                log.info("Redirect notice at {} could not be resolved, returning it as is", current.url());
            }
            return CompletableFuture.completedFuture(new Resolution(current, current.url(), fetches, hop.termination()));
        }
        URI next = hop.next().get();
        if (guard.isBlocked(next)) {
            log.warn("Redirect chain from {} points at internal host {}, not following", current.url(), next.getHost());
            return CompletableFuture.completedFuture(
                    new Resolution(current, current.url(), fetches, Resolution.Termination.BLOCKED_TARGET));
        }
        if (hops >= maxHops) {
            log.warn("Redirect chain exceeded {} hops at {}, returning the last answer", maxHops, current.url());
            return CompletableFuture.completedFuture(
                    new Resolution(current, current.url(), fetches, Resolution.Termination.HOP_LIMIT));
        }
        if (log.isDebugEnabled())
            log.debug("Hop {}: {} -> {} ({})", hops, current.url(), next, hop.kind());

        FetchOptions nextOptions = keepsMethod(current)
                ? options
                : options.withMethod(HttpMethod.GET).withBody(null).withoutHeader("Content-Type");
        return fetcher.fetchWithRetry(next, session, nextOptions)
                .thenCompose(result -> step(result, hops + 1, fetches + 1, session, nextOptions));
    }

    private static boolean keepsMethod(FetchResult current) {
        return current.isRedirect() && (current.status() == 307 || current.status() == 308);
    }

    private record Hop(Optional<URI> next, String kind, Resolution.Termination termination) {
        static Hop stop(Resolution.Termination termination) {
            return new Hop(Optional.empty(), null, termination);
        }

        static Hop to(Optional<URI> next, String kind) {
            return next.isPresent() ? new Hop(next, kind, null) : stop(Resolution.Termination.FINAL);
        }
    }

    private Hop nextHop(FetchResult current) {
        URI url = current.url();
        if (current.isRedirect()) {
            return Hop.to(Urls.resolve(url, current.location()), "http " + current.status());
        }
        if (!current.isHtml() || current.body().length == 0) {
            return Hop.stop(Resolution.Termination.FINAL);
        }
        String html = current.bodyText();
        Document doc = Jsoup.parse(html, url.toString());

        if (current.status() == 200 && detector.isInterstitial(html, url)) {
            for (DestinationStrategy strategy : NOTICE_STRATEGIES) {
                Optional<URI> target = strategy.extract(doc, html, url).filter(t -> !t.equals(url));
                if (target.isPresent()) {
                    return Hop.to(target, strategy.name());
                }
            }
            return Hop.stop(Resolution.Termination.UNRESOLVED_INTERSTITIAL);
        }

        Optional<URI> refresh = DestinationStrategy.META_REFRESH.extract(doc, html, url).filter(t -> !t.equals(url));
        if (refresh.isPresent()) {
            return Hop.to(refresh, "meta refresh");
        }
        return Hop.to(DestinationStrategy.JS_ASSIGNMENT.extract(doc, html, url).filter(t -> !t.equals(url)), "script");
    }
}
