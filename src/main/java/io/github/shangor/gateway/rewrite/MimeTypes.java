package io.github.shangor.gateway.rewrite;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Content-type correction for proxied resources. A known extension on the
 * requested path wins over whatever the upstream declared.
 */
public final class MimeTypes {
    public static final String CSS = "text/css; charset=utf-8";
    public static final String JAVASCRIPT = "application/javascript; charset=utf-8";
    public static final String HTML = "text/html; charset=utf-8";
    public static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry(".css", CSS),
            Map.entry(".js", JAVASCRIPT),
            Map.entry(".mjs", JAVASCRIPT),
            Map.entry(".json", "application/json; charset=utf-8"),
            Map.entry(".woff", "font/woff"),
            Map.entry(".woff2", "font/woff2"),
            Map.entry(".ttf", "font/ttf"),
            Map.entry(".otf", "font/otf"),
            Map.entry(".eot", "application/vnd.ms-fontobject"),
            Map.entry(".svg", "image/svg+xml"),
            Map.entry(".png", "image/png"),
            Map.entry(".jpg", "image/jpeg"),
            Map.entry(".jpeg", "image/jpeg"),
            Map.entry(".gif", "image/gif"),
            Map.entry(".webp", "image/webp"),
            Map.entry(".ico", "image/x-icon"),
            Map.entry(".mp4", "video/mp4"),
            Map.entry(".webm", "video/webm"),
            Map.entry(".mp3", "audio/mpeg"),
            Map.entry(".wav", "audio/wav"),
            Map.entry(".pdf", "application/pdf"),
            Map.entry(".xml", "application/xml"),
            Map.entry(".txt", "text/plain"),
            Map.entry(".html", HTML),
            Map.entry(".htm", HTML));

    private static final Set<String> NON_HTML_EXTENSIONS = Set.of(
            ".css", ".js", ".mjs", ".json", ".woff", ".woff2", ".ttf", ".otf", ".eot");

    private static final int ERROR_SNIFF_CHARS = 500;

    private MimeTypes() {
    }

    /**
     * Lower-case extension of the last path segment, dot included. Query and
     * fragment are ignored.
     */
    public static Optional<String> extension(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String clean = stripQuery(path);
        int slash = clean.lastIndexOf('/');
        int dot = clean.lastIndexOf('.');
        if (dot <= slash || dot == clean.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(clean.substring(dot).toLowerCase(Locale.ROOT));
    }

    /**
     * The content type a resource should be served with.
     *
     * @param declared the upstream Content-Type, null when none was sent
     * @param accept   the browser's Accept header, may be null
     */
    public static String correct(String path, String declared, String accept) {
        Optional<String> byExtension = extension(path).map(BY_EXTENSION::get);
        if (byExtension.isPresent()) {
            return byExtension.get();
        }
        String acceptLower = accept == null ? "" : accept.toLowerCase(Locale.ROOT);
        if (acceptLower.contains("text/css")) {
            return CSS;
        }
        if (acceptLower.contains("application/javascript") || acceptLower.contains("text/javascript")) {
            return JAVASCRIPT;
        }
        if (acceptLower.contains("font/") || acceptLower.contains("application/font")) {
            if (acceptLower.contains("woff2")) {
                return "font/woff2";
            }
            if (acceptLower.contains("woff")) {
                return "font/woff";
            }
            return acceptLower.contains("ttf") ? "font/ttf" : "font/woff2";
        }
        if (declared == null || declared.isBlank()) {
            // CMS endpoints like /?css=main or /wp-content/style-loader
            String lowerPath = stripQuery(path == null ? "" : path).toLowerCase(Locale.ROOT);
            if (lowerPath.contains("css") || lowerPath.contains("style")) {
                return CSS;
            }
            if (lowerPath.contains("/js/") || lowerPath.contains("script")) {
                return JAVASCRIPT;
            }
            return "text/html";
        }
        return declared;
    }

    /**
     * Whether the browser asked for something that must not be HTML, judged by
     * the path extension or the Accept header.
     */
    public static boolean expectsNonHtml(String path, String accept) {
        if (extension(path).filter(NON_HTML_EXTENSIONS::contains).isPresent()) {
            return true;
        }
        String acceptLower = accept == null ? "" : accept.toLowerCase(Locale.ROOT);
        return acceptLower.contains("text/css") || acceptLower.contains("javascript");
    }

    /**
     * A text/html answer whose first characters look like a document or an
     * error page.
     */
    public static boolean looksLikeHtmlErrorPage(byte[] body, String contentType) {
        if (contentType == null || !isHtml(contentType)) {
            return false;
        }
        int len = Math.min(body.length, ERROR_SNIFF_CHARS * 4);
        String head = new String(body, 0, len, StandardCharsets.UTF_8);
        if (head.length() > ERROR_SNIFF_CHARS) {
            head = head.substring(0, ERROR_SNIFF_CHARS);
        }
        head = head.toLowerCase(Locale.ROOT);
        return head.contains("<!doctype")
                || head.contains("<html")
                || head.contains("404")
                || head.contains("not found")
                || head.contains("error");
    }

    /**
     * Type for an empty fallback body, from the extension alone.
     */
    public static String forPath(String path) {
        return extension(path).map(BY_EXTENSION::get).orElse(OCTET_STREAM);
    }

    public static boolean isHtml(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html");
    }

    public static boolean isCss(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/css");
    }

    public static boolean isJavaScript(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("javascript");
    }

    /**
     * Sub-resources get an empty typed body on failure instead of an error page.
     */
    public static boolean isSubResource(String path, String accept) {
        Optional<String> ext = extension(path);
        if (ext.isPresent()) {
            return !ext.get().equals(".html") && !ext.get().equals(".htm");
        }
        return expectsNonHtml(path, accept);
    }

    private static String stripQuery(String path) {
        int cut = path.length();
        int q = path.indexOf('?');
        if (q >= 0) {
            cut = q;
        }
        int h = path.indexOf('#');
        if (h >= 0 && h < cut) {
            cut = h;
        }
        return path.substring(0, cut);
    }
}
