package io.github.shangor.gateway.util;

import io.github.shangor.gateway.error.InvalidUrlException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * URL helpers shared by the fetcher, the rewriter and the routes.
 * <p>
 * {@link java.net.URI} is stricter than browsers, so raw references are escaped
 * before parsing: anything outside the RFC 3986 character set is percent-encoded
 * as UTF-8 while existing escapes are left alone.
 */
public final class Urls {

    private static final String ALLOWED = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789"
            + "-._~:/?#[]@!$&'()*+,;=%";

    private Urls() {
    }

    /**
     * Parses an absolute http(s) URL with a host.
     *
     * @throws InvalidUrlException when the value is not an absolute http(s) URL
     */
    public static URI parseAbsolute(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidUrlException(String.valueOf(value));
        }
        URI uri;
        try {
            uri = new URI(escapeIllegal(value.trim()));
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(value, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !isHttpScheme(scheme) || uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new InvalidUrlException(value);
        }
        return uri;
    }

    /**
     * Resolves a reference against a base URL the way a browser would, returning
     * empty when the reference cannot be parsed or is not http(s) afterwards.
     */
    public static Optional<URI> resolve(URI base, String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        String ref = reference.trim();
        if (ref.isEmpty()) {
            return Optional.empty();
        }
        try {
            URI root = withPath(base);
            URI resolved;
            if (ref.startsWith("//")) {
                resolved = new URI(escapeIllegal(root.getScheme() + ":" + ref));
            } else if (ref.startsWith("?")) {
                // URI.resolve drops the last path segment for query-only references
                resolved = new URI(root.getScheme() + "://" + root.getRawAuthority() + root.getRawPath() + escapeIllegal(ref));
            } else {
                resolved = root.resolve(new URI(escapeIllegal(ref)));
            }
            if (resolved.getScheme() == null || !isHttpScheme(resolved.getScheme()) || resolved.getHost() == null) {
                return Optional.empty();
            }
            return Optional.of(withPath(resolved));
        } catch (URISyntaxException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static boolean isHttpScheme(String scheme) {
        String s = scheme.toLowerCase(Locale.ROOT);
        return s.equals("http") || s.equals("https");
    }

    /**
     * scheme://host[:port] of an absolute URL, without trailing slash.
     */
    public static String origin(URI uri) {
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme().toLowerCase(Locale.ROOT)).append("://").append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }
        return sb.toString();
    }

    public static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    /**
     * Path plus query in origin form, as sent on the request line.
     */
    public static String requestTarget(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }

    /**
     * Percent-encodes a component like the browser's {@code encodeURIComponent}.
     */
    public static String encodeComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }

    public static String decodeComponent(String value) {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    static String escapeIllegal(String value) {
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean ok = c < 0x80 && ALLOWED.indexOf(c) >= 0;
            if (c == '%' && !isEscape(value, i)) {
                ok = false;
            }
            if (ok) {
                if (sb != null) {
                    sb.append(c);
                }
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(value.length() + 16);
                sb.append(value, 0, i);
            }
            int cp = value.codePointAt(i);
            if (Character.charCount(cp) == 2) {
                i++;
            }
            for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%').append(String.format("%02X", b & 0xFF));
            }
        }
        return sb == null ? value : sb.toString();
    }

    private static boolean isEscape(String value, int i) {
        return i + 2 < value.length()
                && Character.digit(value.charAt(i + 1), 16) >= 0
                && Character.digit(value.charAt(i + 2), 16) >= 0;
    }

    private static URI withPath(URI uri) throws URISyntaxException {
        if (uri.getRawPath() != null && !uri.getRawPath().isEmpty()) {
            return uri;
        }
        return new URI(uri.getScheme() + "://" + uri.getRawAuthority() + "/"
                + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "")
                + (uri.getRawFragment() != null ? "#" + uri.getRawFragment() : ""));
    }
}
