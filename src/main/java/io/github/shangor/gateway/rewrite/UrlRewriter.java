package io.github.shangor.gateway.rewrite;

import io.github.shangor.gateway.error.InvalidUrlException;
import io.github.shangor.gateway.util.Urls;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a reference found in proxied content onto a gateway path.
 * <ul>
 *   <li>same host as the target: {@code /browse<path><query><fragment>}</li>
 *   <li>any other host: {@code /external/<encodeURIComponent(absolute url)>}</li>
 *   <li>navigation mode links and forms: {@code /navigate?url=<encoded>}</li>
 * </ul>
 * References that must stay as they are (data:, javascript:, mailto:, tel:,
 * fragment-only, already-rewritten gateway paths) yield empty.
 */
public final class UrlRewriter {
    public static final String BROWSE_PREFIX = "/browse";
    public static final String EXTERNAL_PREFIX = "/external/";
    public static final String NAVIGATE_PREFIX = "/navigate?url=";

    private static final String[] SKIPPED_SCHEMES = {"data:", "javascript:", "mailto:", "tel:", "blob:", "about:"};

    private final URI targetOrigin;
    private final String targetHost;

    public UrlRewriter(URI targetOrigin) {
        this.targetOrigin = targetOrigin;
        this.targetHost = targetOrigin.getHost().toLowerCase(Locale.ROOT);
    }

    public URI targetOrigin() {
        return targetOrigin;
    }

    public Optional<String> rewrite(String reference) {
        return rewrite(reference, targetOrigin);
    }

    /**
     * @param base the URL relative references resolve against, normally the
     *             document's own URL on the target site, never the gateway's
     */
    public Optional<String> rewrite(String reference, URI base) {
        if (isLeftAlone(reference) || isGatewayPath(reference)) {
            return Optional.empty();
        }
        return absolute(reference, base).map(abs -> isTargetHost(abs.uri())
                ? toBrowse(abs.uri())
                : EXTERNAL_PREFIX + Urls.encodeComponent(abs.text()));
    }

    /**
     * Navigation-mode rewrite for links and form actions: every target goes
     * through {@code /navigate} so the next page is resolved and rewritten too.
     */
    public Optional<String> rewriteNavigation(String reference, URI base) {
        if (isLeftAlone(reference) || isGatewayPath(reference)) {
            return Optional.empty();
        }
        return absolute(reference, base).map(abs -> toNavigate(abs.text()));
    }

    /**
     * Navigation-mode rewrite for sub-resources: always {@code /external/},
     * the page being shown does not belong to the target site.
     */
    public Optional<String> rewriteResource(String reference, URI base) {
        if (isLeftAlone(reference) || isGatewayPath(reference)) {
            return Optional.empty();
        }
        return absolute(reference, base).map(abs -> EXTERNAL_PREFIX + Urls.encodeComponent(abs.text()));
    }

    public boolean isTargetHost(URI uri) {
        return uri.getHost() != null && uri.getHost().toLowerCase(Locale.ROOT).equals(targetHost);
    }

    public static String toBrowse(URI absolute) {
        String path = absolute.getRawPath() == null || absolute.getRawPath().isEmpty() ? "/" : absolute.getRawPath();
        StringBuilder sb = new StringBuilder(BROWSE_PREFIX).append(path);
        if (absolute.getRawQuery() != null) {
            sb.append('?').append(absolute.getRawQuery());
        }
        if (absolute.getRawFragment() != null) {
            sb.append('#').append(absolute.getRawFragment());
        }
        return sb.toString();
    }

    public static String toExternal(String absoluteUrl) {
        return EXTERNAL_PREFIX + Urls.encodeComponent(absoluteUrl);
    }

    public static String toNavigate(String absoluteUrl) {
        return NAVIGATE_PREFIX + Urls.encodeComponent(absoluteUrl);
    }

    /**
     * The absolute URL carried by an {@code /external/} path segment.
     *
     * @throws InvalidUrlException when the value carries a broken escape
     */
    public static String decodeExternal(String encoded) {
        try {
            return Urls.decodeComponent(encoded);
        } catch (IllegalArgumentException e) {
            throw new InvalidUrlException(encoded, e);
        }
    }

    public static boolean isLeftAlone(String reference) {
        if (reference == null) {
            return true;
        }
        String ref = reference.trim();
        if (ref.isEmpty() || ref.startsWith("#")) {
            return true;
        }
        String lower = ref.toLowerCase(Locale.ROOT);
        for (String scheme : SKIPPED_SCHEMES) {
            if (lower.startsWith(scheme)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True for references already pointing at a gateway route. The prefix must
     * end at a path boundary, so {@code /browser.css} is still a target path.
     */
    public static boolean isGatewayPath(String reference) {
        String ref = reference.trim();
        return hasRoutePrefix(ref, BROWSE_PREFIX) || hasRoutePrefix(ref, "/external") || hasRoutePrefix(ref, "/navigate");
    }

    private static boolean hasRoutePrefix(String ref, String prefix) {
        if (!ref.startsWith(prefix)) {
            return false;
        }
        if (ref.length() == prefix.length()) {
            return true;
        }
        char next = ref.charAt(prefix.length());
        return next == '/' || next == '?' || next == '#';
    }

    /**
     * Absolute form of a reference. An already absolute http(s) reference keeps
     * its exact text so {@code /external/} decodes back to what the page had.
     */
    private static Optional<Absolute> absolute(String reference, URI base) {
        String ref = reference.trim();
        return Urls.resolve(base, ref).map(uri -> {
            String lower = ref.toLowerCase(Locale.ROOT);
            boolean alreadyAbsolute = lower.startsWith("http://") || lower.startsWith("https://");
            return new Absolute(uri, alreadyAbsolute ? ref : uri.toString());
        });
    }

    private record Absolute(URI uri, String text) {
    }
}
