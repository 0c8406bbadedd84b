package io.github.shangor.gateway.intercept;

import io.github.shangor.gateway.util.Urls;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pure request classification shared by the server and the browser shims.
 * The rule lists are published to the shims by {@link InterceptorRules} so both
 * sides route a URL the same way.
 */
public class TrafficClassifier {

    public enum RequestKind {
        DOCUMENT,
        FRAME,
        RESOURCE
    }

    static final List<String> BYPASS_PREFIXES = List.of(
            "/relay", "/browse", "/external", "/navigate", "/sw.js", "/gateway/", "/proceed", "/reset", "/favicon");

    static final List<String> NON_NETWORK_SCHEMES = List.of("data:", "blob:", "about:", "chrome-extension:", "javascript:");

    static final List<String> AD_HOSTS = List.of(
            "doubleclick.net",
            "googlesyndication.com",
            "googleadservices.com",
            "googletagservices.com",
            "adservice.google",
            "googleads",
            "adtrafficquality.google",
            "fundingchoicesmessages.google.com");

    /** host fragment and path prefix that together mark ad traffic on shared hosts */
    static final List<List<String>> AD_HOST_PATHS = List.of(
            List.of("google.com", "/aclk"),
            List.of("google.com", "/url"),
            List.of("google.com", "/recaptcha"),
            List.of("gstatic.com", "/recaptcha"));

    static final List<String> AD_PATH_MARKERS = List.of("/aclk", "/pagead", "/adclick", "/sodar");

    /**
     * @param url           the request URL as the page issued it, possibly relative
     * @param gatewayOrigin origin the page was served from
     */
    public TrafficClass classify(String url, URI gatewayOrigin, RequestKind kind) {
        if (url == null || url.isBlank()) {
            return TrafficClass.BYPASS;
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        for (String scheme : NON_NETWORK_SCHEMES) {
            if (lower.startsWith(scheme)) {
                return TrafficClass.BYPASS;
            }
        }
        Optional<URI> resolved = Urls.resolve(gatewayOrigin, url);
        if (resolved.isEmpty()) {
            return TrafficClass.BYPASS;
        }
        URI target = resolved.get();
        if (Urls.origin(target).equals(Urls.origin(gatewayOrigin))) {
            String path = target.getRawPath();
            return BYPASS_PREFIXES.stream().anyMatch(path::startsWith) ? TrafficClass.BYPASS : TrafficClass.SAME_ORIGIN;
        }
        if (kind == RequestKind.DOCUMENT || kind == RequestKind.FRAME) {
            return TrafficClass.EXTERNAL_NAVIGATION;
        }
        return isAd(target) ? TrafficClass.AD : TrafficClass.EXTERNAL_RESOURCE;
    }

    public boolean isAd(URI url) {
        String host = url.getHost() == null ? "" : url.getHost().toLowerCase(Locale.ROOT);
        String path = url.getRawPath() == null ? "" : url.getRawPath().toLowerCase(Locale.ROOT);
        for (String adHost : AD_HOSTS) {
            if (host.contains(adHost)) {
                return true;
            }
        }
        for (List<String> rule : AD_HOST_PATHS) {
            if (host.contains(rule.get(0)) && path.startsWith(rule.get(1))) {
                return true;
            }
        }
        for (String marker : AD_PATH_MARKERS) {
            if (path.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
