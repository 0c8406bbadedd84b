package io.github.shangor.gateway.rewrite;

import java.net.URI;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code url(...)} and string {@code @import} references in
 * stylesheets and inline style attributes.
 */
public class CssRewriter {
    static final Pattern URL_FUNCTION = Pattern.compile("url\\(\\s*(['\"]?)([^'\")\\s]+)\\1\\s*\\)", Pattern.CASE_INSENSITIVE);
    static final Pattern STRING_IMPORT = Pattern.compile("@import\\s+(['\"])([^'\"]+)\\1", Pattern.CASE_INSENSITIVE);

    private final UrlRewriter urls;

    public CssRewriter(UrlRewriter urls) {
        this.urls = urls;
    }

    /**
     * @param base the stylesheet's own URL, or the document URL for inline styles
     */
    public String rewrite(String css, URI base) {
        return rewrite(css, ref -> urls.rewrite(ref, base));
    }

    /**
     * Rewrites with a caller-chosen mapping, used by navigation mode where
     * every reference becomes an {@code /external/} path.
     */
    public String rewrite(String css, Function<String, Optional<String>> mapping) {
        if (css == null || css.isEmpty()) {
            return css;
        }
        String out = replace(URL_FUNCTION, css, mapping, "url('%s')");
        return replace(STRING_IMPORT, out, mapping, "@import '%s'");
    }

    private static String replace(Pattern pattern, String css, Function<String, Optional<String>> mapping, String format) {
        Matcher m = pattern.matcher(css);
        StringBuilder sb = null;
        while (m.find()) {
            Optional<String> rewritten = mapping.apply(m.group(2));
            if (rewritten.isEmpty()) {
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(css.length() + 64);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(String.format(format, rewritten.get())));
        }
        if (sb == null) {
            return css;
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
