package io.github.shangor.gateway.upstream;

import io.netty.handler.codec.http.HttpMethod;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Per-call knobs for {@link UpstreamFetcher}. Immutable; the {@code with*}
 * methods return copies.
 */
public final class FetchOptions {
    private static final Consumer<FetchResult> IGNORE_HOPS = hop -> {
    };
    private static final FetchOptions DEFAULTS = new FetchOptions(HttpMethod.GET, Map.of(), null, null, true, IGNORE_HOPS);

    private final HttpMethod method;
    private final Map<String, String> headers;
    private final String cookies;
    private final byte[] body;
    private final boolean followRedirects;
    private final Consumer<FetchResult> redirectListener;

    private FetchOptions(HttpMethod method, Map<String, String> headers, String cookies, byte[] body,
                         boolean followRedirects, Consumer<FetchResult> redirectListener) {
        this.method = method;
        this.headers = headers;
        this.cookies = cookies;
        this.body = body;
        this.followRedirects = followRedirects;
        this.redirectListener = redirectListener;
    }

    public static FetchOptions defaults() {
        return DEFAULTS;
    }

    public FetchOptions withMethod(HttpMethod method) {
        return new FetchOptions(method, headers, cookies, body, followRedirects, redirectListener);
    }

    public FetchOptions withHeader(String name, String value) {
        if (value == null) {
            return this;
        }
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new FetchOptions(method, Collections.unmodifiableMap(copy), cookies, body, followRedirects, redirectListener);
    }

    public FetchOptions withoutHeader(String name) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.keySet().removeIf(k -> k.equalsIgnoreCase(name));
        return new FetchOptions(method, Collections.unmodifiableMap(copy), cookies, body, followRedirects, redirectListener);
    }

    public FetchOptions withHeaders(Map<String, String> extra) {
        FetchOptions options = this;
        for (Map.Entry<String, String> e : extra.entrySet()) {
            options = options.withHeader(e.getKey(), e.getValue());
        }
        return options;
    }

    public FetchOptions withCookies(String cookieHeader) {
        return new FetchOptions(method, headers, cookieHeader == null || cookieHeader.isEmpty() ? null : cookieHeader,
                body, followRedirects, redirectListener);
    }

    public FetchOptions withBody(byte[] body) {
        return new FetchOptions(method, headers, cookies, body, followRedirects, redirectListener);
    }

    public FetchOptions withFollowRedirects(boolean followRedirects) {
        return new FetchOptions(method, headers, cookies, body, followRedirects, redirectListener);
    }

    /**
     * Called with every redirect answer that is followed, before the next hop
     * is requested. The final answer is not passed here.
     */
    public FetchOptions withRedirectListener(Consumer<FetchResult> listener) {
        return new FetchOptions(method, headers, cookies, body, followRedirects, listener);
    }

    public HttpMethod method() {
        return method;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public String cookies() {
        return cookies;
    }

    public byte[] body() {
        return body;
    }

    public boolean followRedirects() {
        return followRedirects;
    }

    public Consumer<FetchResult> redirectListener() {
        return redirectListener;
    }
}
