package io.github.shangor.gateway.intercept;

import io.github.shangor.gateway.util.Urls;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Makes ad verification see the target site instead of the gateway: every
 * occurrence of the gateway origin (plain or percent-encoded, with or without
 * the {@code /browse} prefix) in the query string and in the Referer is
 * replaced by the target origin.
 */
public class AdReferenceRewriter {

    static final List<String> VERIFYING_HOSTS = List.of("googlesyndication", "doubleclick", "googleads", "adtrafficquality");

    public boolean appliesTo(URI url) {
        String host = url.getHost() == null ? "" : url.getHost().toLowerCase(Locale.ROOT);
        return VERIFYING_HOSTS.stream().anyMatch(host::contains);
    }

    /**
     * Rewrites the query of an ad URL; the rest of the URL is left as is.
     */
    public String rewriteUrl(String url, String gatewayOrigin, String targetOrigin) {
        int q = url.indexOf('?');
        if (q < 0) {
            return url;
        }
        int hash = url.indexOf('#', q);
        String query = hash < 0 ? url.substring(q + 1) : url.substring(q + 1, hash);
        String fragment = hash < 0 ? "" : url.substring(hash);
        return url.substring(0, q + 1) + replaceOrigins(query, gatewayOrigin, targetOrigin) + fragment;
    }

    public String rewriteReferer(String referer, String gatewayOrigin, String targetOrigin) {
        if (referer == null) {
            return null;
        }
        return replaceOrigins(referer, gatewayOrigin, targetOrigin);
    }

    static String replaceOrigins(String text, String gatewayOrigin, String targetOrigin) {
        String browse = gatewayOrigin + "/browse";
        String out = replaceAll(text, Urls.encodeComponent(browse), Urls.encodeComponent(targetOrigin));
        out = replaceAll(out, Urls.encodeComponent(gatewayOrigin), Urls.encodeComponent(targetOrigin));
        out = replaceAll(out, browse, targetOrigin);
        return replaceAll(out, gatewayOrigin, targetOrigin);
    }

    private static String replaceAll(String text, String literal, String replacement) {
        Pattern p = Pattern.compile(Pattern.quote(literal), Pattern.CASE_INSENSITIVE);
        return p.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }
}
