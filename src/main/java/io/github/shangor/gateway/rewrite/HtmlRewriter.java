package io.github.shangor.gateway.rewrite;

import io.github.shangor.gateway.util.Urls;
import org.jsoup.Jsoup;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites every URL-bearing attribute of a document in one parse. Best
 * effort: script bodies are left to the browser-side interceptor.
 */
public class HtmlRewriter {
    private static final Logger log = LoggerFactory.getLogger(HtmlRewriter.class);

    static final Pattern META_REFRESH = Pattern.compile("^\\s*(\\d+)\\s*[;,]\\s*url\\s*=\\s*['\"]?([^'\"]+?)['\"]?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private enum Kind {
        LINK,
        RESOURCE,
        SRCSET
    }

    private record Target(String selector, String attribute, Kind kind) {
    }

    private static final List<Target> TARGETS = List.of(
            new Target("a[href], area[href]", "href", Kind.LINK),
            new Target("form[action]", "action", Kind.LINK),
            new Target("img[src], source[src], video[src], audio[src], track[src], input[src]", "src", Kind.RESOURCE),
            new Target("img[srcset], source[srcset]", "srcset", Kind.SRCSET),
            new Target("[data-src]", "data-src", Kind.RESOURCE),
            new Target("[data-srcset]", "data-srcset", Kind.SRCSET),
            new Target("[data-lazy-src]", "data-lazy-src", Kind.RESOURCE),
            new Target("[data-lazy-srcset]", "data-lazy-srcset", Kind.SRCSET),
            new Target("[data-bg]", "data-bg", Kind.RESOURCE),
            new Target("[data-background]", "data-background", Kind.RESOURCE),
            new Target("link[href]", "href", Kind.RESOURCE),
            new Target("script[src]", "src", Kind.RESOURCE),
            new Target("video[poster]", "poster", Kind.RESOURCE),
            new Target("object[data]", "data", Kind.RESOURCE),
            new Target("embed[src]", "src", Kind.RESOURCE),
            new Target("iframe[src], frame[src]", "src", Kind.RESOURCE));

    private final UrlRewriter urls;
    private final CssRewriter css;

    public HtmlRewriter(UrlRewriter urls, CssRewriter css) {
        this.urls = urls;
        this.css = css;
    }

    public String rewrite(String html, URI pageUrl, RewriteMode mode, Injection injection) {
        Document doc = Jsoup.parse(html, pageUrl.toString());
        doc.outputSettings().prettyPrint(false);

        URI base = documentBase(doc, pageUrl);
        Function<String, Optional<String>> links = mode == RewriteMode.BROWSE
                ? ref -> urls.rewrite(ref, base)
                : ref -> urls.rewriteNavigation(ref, base);
        Function<String, Optional<String>> resources = mode == RewriteMode.BROWSE
                ? ref -> urls.rewrite(ref, base)
                : ref -> urls.rewriteResource(ref, base);

        int rewritten = 0;
        for (Target target : TARGETS) {
            for (Element el : doc.select(target.selector())) {
                String value = el.attr(target.attribute());
                Optional<String> replacement = switch (target.kind()) {
                    case LINK -> links.apply(value);
                    case RESOURCE -> resources.apply(value);
                    case SRCSET -> rewriteSrcset(value, resources);
                };
                if (replacement.isPresent()) {
                    el.attr(target.attribute(), replacement.get());
                    rewritten++;
                }
                if (mode == RewriteMode.NAVIGATION && target.kind() == Kind.LINK) {
                    el.removeAttr("target");
                }
            }
        }

        for (Element el : doc.select("[style]")) {
            String style = el.attr("style");
            String replaced = css.rewrite(style, resources);
            if (!replaced.equals(style)) {
                el.attr("style", replaced);
                rewritten++;
            }
        }
        for (Element el : doc.select("style")) {
            String sheet = el.data();
            String replaced = css.rewrite(sheet, resources);
            if (!replaced.equals(sheet)) {
                el.empty().appendChild(new DataNode(replaced));
                rewritten++;
            }
        }
        for (Element el : doc.select("meta[http-equiv]")) {
            if (!"refresh".equalsIgnoreCase(el.attr("http-equiv"))) {
                continue;
            }
            Matcher m = META_REFRESH.matcher(el.attr("content"));
            if (m.matches()) {
                Optional<String> target = links.apply(m.group(2));
                if (target.isPresent()) {
                    el.attr("content", m.group(1) + "; url=" + target.get());
                    rewritten++;
                }
            }
        }

        inject(doc, injection);
        if (log.isDebugEnabled())
            log.debug("Rewrote {} references in {} ({})", rewritten, pageUrl, mode);
        return doc.outerHtml();
    }

    /**
     * Honours {@code <base href>} for resolution and then drops the element:
     * after rewriting, every reference is a gateway path and a leftover base
     * would point them back at the target.
     */
    private static URI documentBase(Document doc, URI pageUrl) {
        URI base = pageUrl;
        Element baseEl = doc.selectFirst("base[href]");
        if (baseEl != null) {
            base = Urls.resolve(pageUrl, baseEl.attr("href")).orElse(pageUrl);
        }
        doc.select("base").remove();
        return base;
    }

    static Optional<String> rewriteSrcset(String srcset, Function<String, Optional<String>> mapping) {
        if (srcset == null || srcset.isBlank()) {
            return Optional.empty();
        }
        boolean changed = false;
        StringBuilder sb = new StringBuilder(srcset.length() + 32);
        for (String part : srcset.split(",")) {
            String candidate = part.trim();
            if (candidate.isEmpty()) {
                continue;
            }
            String[] pieces = candidate.split("\\s+", 2);
            Optional<String> url = mapping.apply(pieces[0]);
            if (sb.length() > 0) {
                sb.append(", ");
            }
            if (url.isPresent()) {
                changed = true;
                sb.append(url.get());
                if (pieces.length > 1) {
                    sb.append(' ').append(pieces[1]);
                }
            } else {
                sb.append(candidate);
            }
        }
        return changed ? Optional.of(sb.toString()) : Optional.empty();
    }

    private static void inject(Document doc, Injection injection) {
        if (injection.head() != null) {
            doc.head().prepend(injection.head());
        }
        if (injection.body() != null) {
            doc.body().append(injection.body());
        }
    }
}
