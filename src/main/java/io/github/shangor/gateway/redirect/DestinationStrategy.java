package io.github.shangor.gateway.redirect;

import io.github.shangor.gateway.util.Urls;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ways of pulling the destination out of a redirect notice, tried in
 * declaration order; the first that yields a URL wins.
 */
public enum DestinationStrategy {
    /**
     * First anchor leaving the notice's host whose text is not a "go back" label.
     */
    ANCHOR_HEURISTIC {
        @Override
        public Optional<URI> extract(Document doc, String html, URI pageUrl) {
            for (Element a : doc.select("a[href]")) {
                if (isBackLabel(a.text())) {
                    continue;
                }
                Optional<URI> target = Urls.resolve(pageUrl, a.attr("href"));
                if (target.isPresent() && !sameHost(target.get(), pageUrl)) {
                    return target;
                }
            }
            return Optional.empty();
        }
    },
    META_REFRESH {
        @Override
        public Optional<URI> extract(Document doc, String html, URI pageUrl) {
            for (Element meta : doc.select("meta[http-equiv]")) {
                if (!"refresh".equalsIgnoreCase(meta.attr("http-equiv"))) {
                    continue;
                }
                Matcher m = REFRESH_CONTENT.matcher(meta.attr("content"));
                if (m.find()) {
                    return Urls.resolve(pageUrl, m.group(1).trim());
                }
            }
            return Optional.empty();
        }
    },
    /**
     * A location assignment that runs when the script loads, not one bound to
     * a click or other handler.
     */
    JS_ASSIGNMENT {
        @Override
        public Optional<URI> extract(Document doc, String html, URI pageUrl) {
            for (Element script : doc.select("script")) {
                if (script.hasAttr("src")) {
                    continue;
                }
                String code = script.data();
                for (Pattern pattern : JS_REDIRECTS) {
                    Matcher m = pattern.matcher(code);
                    while (m.find()) {
                        if (runsImmediately(code, m.start())) {
                            Optional<URI> target = Urls.resolve(pageUrl, unescapeJs(m.group(1)));
                            if (target.isPresent()) {
                                return target;
                            }
                        }
                    }
                }
            }
            return Optional.empty();
        }
    },
    /**
     * A link labelled "continue", "proceed" and the like, on any host.
     */
    LABELLED_LINK {
        @Override
        public Optional<URI> extract(Document doc, String html, URI pageUrl) {
            for (Element a : doc.select("a[href]")) {
                String text = a.text().toLowerCase(Locale.ROOT);
                boolean labelled = CONTINUE_LABELS.stream().anyMatch(text::contains);
                if (!labelled) {
                    continue;
                }
                Optional<URI> target = Urls.resolve(pageUrl, a.attr("href"));
                if (target.isPresent() && !target.get().equals(pageUrl)) {
                    return target;
                }
            }
            return Optional.empty();
        }
    },
    /**
     * Last resort: the first absolute URL in the raw markup that leaves the
     * notice's host and is not a static asset or a markup namespace.
     */
    PATTERN_SCAN {
        @Override
        public Optional<URI> extract(Document doc, String html, URI pageUrl) {
            Matcher m = ABSOLUTE_URL.matcher(html);
            while (m.find()) {
                String candidate = m.group().replace("&amp;", "&");
                Optional<URI> target = Urls.resolve(pageUrl, candidate);
                if (target.isEmpty() || sameHost(target.get(), pageUrl)) {
                    continue;
                }
                String host = target.get().getHost().toLowerCase(Locale.ROOT);
                if (IGNORED_HOSTS.stream().anyMatch(ignored -> host.equals(ignored) || host.endsWith("." + ignored))) {
                    continue;
                }
                String path = target.get().getRawPath().toLowerCase(Locale.ROOT);
                if (STATIC_SUFFIXES.stream().anyMatch(path::endsWith)) {
                    continue;
                }
                return target;
            }
            return Optional.empty();
        }
    };

    static final Pattern REFRESH_CONTENT = Pattern.compile("url\\s*=\\s*['\"]?([^'\"]+)", Pattern.CASE_INSENSITIVE);

    static final List<Pattern> JS_REDIRECTS = List.of(
            Pattern.compile("(?:window\\.|document\\.|top\\.|self\\.)?location(?:\\.href)?\\s*=\\s*['\"]([^'\"]+)['\"]"),
            Pattern.compile("(?:window\\.|document\\.|top\\.|self\\.)?location\\.(?:replace|assign)\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)"));

    static final Pattern NAMED_FUNCTION = Pattern.compile("function\\s+[\\w$]+\\s*\\([^)]*\\)\\s*$");
    static final Pattern HANDLER_BINDING = Pattern.compile("(addEventListener\\s*\\(|\\.on[a-z]+\\s*=|\\bon[a-z]+\\s*:)[^;{}]*$");

    static final Pattern ABSOLUTE_URL = Pattern.compile("https?://[^\\s\"'<>()\\\\]+");

    static final List<String> BACK_LABELS = List.of("back", "previous page", "return", "cancel", "go back");
    static final List<String> CONTINUE_LABELS = List.of("continue", "proceed", "click here", "go to", "visit", "open link");
    static final List<String> IGNORED_HOSTS = List.of("w3.org", "schema.org", "ogp.me", "fonts.googleapis.com", "fonts.gstatic.com");
    static final List<String> STATIC_SUFFIXES = List.of(".js", ".css", ".png", ".jpg", ".jpeg", ".gif", ".svg", ".webp",
            ".ico", ".woff", ".woff2", ".ttf", ".json", ".xml", ".dtd");

    public abstract Optional<URI> extract(Document doc, String html, URI pageUrl);

    static boolean sameHost(URI a, URI b) {
        return a.getHost() != null && b.getHost() != null && a.getHost().equalsIgnoreCase(b.getHost());
    }

    static boolean isBackLabel(String text) {
        String t = text.trim().toLowerCase(Locale.ROOT);
        return BACK_LABELS.stream().anyMatch(t::contains);
    }

    /**
     * Whether code at {@code index} runs on load: no enclosing block is the
     * body of a named function or of a handler registration.
     */
    static boolean runsImmediately(String code, int index) {
        Deque<Integer> open = new ArrayDeque<>();
        char quote = 0;
        for (int i = 0; i < index; i++) {
            char c = code.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '{') {
                open.push(i);
            } else if (c == '}' && !open.isEmpty()) {
                open.pop();
            }
        }
        for (int brace : open) {
            String before = code.substring(Math.max(0, brace - 160), brace);
            if (NAMED_FUNCTION.matcher(before).find() || HANDLER_BINDING.matcher(before).find()) {
                return false;
            }
        }
        return true;
    }

    static String unescapeJs(String value) {
        return value.replace("\\/", "/").replace("\\u0026", "&").replace("\\x26", "&");
    }
}
