package io.github.shangor.gateway.rewrite;

import io.github.shangor.gateway.upstream.FetchResult;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Entry point of the rewriting engine. Pure: no I/O, the caller provides the
 * fetched bytes and gets back the bytes to serve.
 */
public class ContentRewriter {
    private static final Logger log = LoggerFactory.getLogger(ContentRewriter.class);
    private static final byte[] EMPTY = new byte[0];

    private final UrlRewriter urls;
    private final CssRewriter css;
    private final HtmlRewriter html;

    public ContentRewriter(URI targetOrigin) {
        this.urls = new UrlRewriter(targetOrigin);
        this.css = new CssRewriter(urls);
        this.html = new HtmlRewriter(urls, css);
    }

    public UrlRewriter urls() {
        return urls;
    }

    public String rewriteHtml(byte[] body, URI pageUrl) {
        return rewriteHtml(body, StandardCharsets.UTF_8, pageUrl, RewriteMode.BROWSE, Injection.NONE);
    }

    public String rewriteHtml(byte[] body, Charset charset, URI pageUrl, RewriteMode mode, Injection injection) {
        return html.rewrite(new String(body, charset), pageUrl, mode, injection);
    }

    public String rewriteCss(byte[] body, URI sheetUrl) {
        return css.rewrite(new String(body, StandardCharsets.UTF_8), sheetUrl);
    }

    /**
     * Decides type and body for a proxied answer.
     *
     * @param requestPath the path the browser asked for, drives MIME correction
     * @param accept      the browser's Accept header
     */
    public RewrittenContent render(FetchResult result, String requestPath, String accept, RewriteMode mode,
                                   Injection injection) {
        String declared = result.headers().get(HttpHeaderNames.CONTENT_TYPE);
        String upstreamType = result.contentType();
        String type = MimeTypes.correct(requestPath, declared, accept);

        if (MimeTypes.expectsNonHtml(requestPath, accept) && MimeTypes.looksLikeHtmlErrorPage(result.body(), upstreamType)) {
            log.warn("Upstream sent an HTML page for {} (expected {}), serving an empty body", requestPath, type);
            return new RewrittenContent(type, EMPTY, true);
        }
        if (MimeTypes.isCss(type)) {
            String sheet = mode == RewriteMode.BROWSE
                    ? css.rewrite(result.bodyText(), result.url())
                    : css.rewrite(result.bodyText(), ref -> urls.rewriteResource(ref, result.url()));
            return new RewrittenContent(MimeTypes.CSS, sheet.getBytes(StandardCharsets.UTF_8), false);
        }
        if (MimeTypes.isJavaScript(type)) {
            return new RewrittenContent(MimeTypes.JAVASCRIPT, result.body(), false);
        }
        if (MimeTypes.isHtml(type)) {
            String page = html.rewrite(result.bodyText(), result.url(), mode, injection);
            return new RewrittenContent(MimeTypes.HTML, page.getBytes(StandardCharsets.UTF_8), false);
        }
        return new RewrittenContent(type, result.body(), false);
    }
}
