package io.github.shangor.gateway.upstream;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpUtil;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Answer of one upstream exchange. The body stays opaque bytes until a
 * content-type decision is made by the caller.
 *
 * @param url the URL that produced this answer (the last hop when redirects were followed)
 */
public record FetchResult(int status, HttpHeaders headers, byte[] body, URI url) {

    /**
     * Upstream content type, {@code text/html} when none was declared.
     */
    public String contentType() {
        String declared = headers.get(HttpHeaderNames.CONTENT_TYPE);
        return declared == null || declared.isBlank() ? "text/html" : declared;
    }

    public boolean isRedirect() {
        return status >= 300 && status < 400 && status != 304 && headers.contains(HttpHeaderNames.LOCATION);
    }

    public String location() {
        return headers.get(HttpHeaderNames.LOCATION);
    }

    public boolean isHtml() {
        return contentType().toLowerCase(Locale.ROOT).contains("text/html");
    }

    public Charset charset() {
        return HttpUtil.getCharset(contentType(), StandardCharsets.UTF_8);
    }

    public String bodyText() {
        return new String(body, charset());
    }
}
