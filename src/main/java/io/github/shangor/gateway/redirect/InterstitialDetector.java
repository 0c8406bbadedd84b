package io.github.shangor.gateway.redirect;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Recognises HTML "redirect notice" pages: a 200 answer whose only purpose
 * is to forward the visitor somewhere else. Matches on wording in the page
 * or on well-known redirector endpoints.
 */
public class InterstitialDetector {

    static final List<String> PHRASES = List.of(
            "redirect notice",
            "the previous page is sending you to",
            "is trying to send you to",
            "you are being redirected",
            "you will be redirected",
            "you will now be redirected",
            "redirecting you to",
            "redirecting to",
            "if you are not redirected",
            "if you are not automatically redirected",
            "you are now leaving",
            "you are leaving",
            "click here to continue");

    record Redirector(String host, String pathPrefix) {
        boolean matches(URI url) {
            String h = url.getHost() == null ? "" : url.getHost().toLowerCase(Locale.ROOT);
            boolean hostMatch = h.equals(host) || h.endsWith("." + host);
            String path = url.getRawPath() == null ? "" : url.getRawPath();
            return hostMatch && path.startsWith(pathPrefix);
        }
    }

    static final List<Redirector> REDIRECTORS = List.of(
            new Redirector("google.com", "/url"),
            new Redirector("googleadservices.com", "/pagead/aclk"),
            new Redirector("doubleclick.net", "/"),
            new Redirector("adtrafficquality.google", "/"),
            new Redirector("l.facebook.com", "/l.php"),
            new Redirector("lm.facebook.com", "/l.php"),
            new Redirector("out.reddit.com", "/"),
            new Redirector("t.co", "/"),
            new Redirector("away.vk.com", "/"));

    private static final int SCAN_CHARS = 20_000;

    public boolean isInterstitial(String html, URI pageUrl) {
        for (Redirector r : REDIRECTORS) {
            if (r.matches(pageUrl)) {
                return true;
            }
        }
        String head = html.length() > SCAN_CHARS ? html.substring(0, SCAN_CHARS) : html;
        String lower = head.toLowerCase(Locale.ROOT);
        for (String phrase : PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
