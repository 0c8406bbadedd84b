package io.github.shangor.gateway.upstream;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;

import java.net.URI;
import java.util.Locale;

/**
 * One upstream exchange. Host is derived from {@code url} when the request is
 * written, so it is not part of {@code headers}.
 */
public record FetchRequest(URI url, HttpMethod method, HttpHeaders headers, byte[] body, boolean followRedirects) {

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    /**
     * The request to issue for a redirect answer: 303, and 301/302 after a
     * non-GET, turn into a bodyless GET; 307/308 repeat the method and body.
     * Cookie and Authorization are dropped once the hop leaves this host and
     * stay dropped for the rest of the chain.
     */
    public FetchRequest redirectTo(URI next, int status) {
        boolean keepMethod = status == 307 || status == 308
                || method.equals(HttpMethod.GET) || method.equals(HttpMethod.HEAD);
        HttpHeaders copy = new DefaultHttpHeaders().set(headers);
        if (!sameHost(url, next)) {
            copy.remove(HttpHeaderNames.COOKIE);
            copy.remove(HttpHeaderNames.AUTHORIZATION);
        }
        if (keepMethod) {
            return new FetchRequest(next, method, copy, body, followRedirects);
        }
        copy.remove(HttpHeaderNames.CONTENT_TYPE);
        copy.remove(HttpHeaderNames.CONTENT_LENGTH);
        return new FetchRequest(next, HttpMethod.GET, copy, null, followRedirects);
    }

    static boolean sameHost(URI a, URI b) {
        if (a.getHost() == null || b.getHost() == null) {
            return false;
        }
        return a.getHost().toLowerCase(Locale.ROOT).equals(b.getHost().toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
