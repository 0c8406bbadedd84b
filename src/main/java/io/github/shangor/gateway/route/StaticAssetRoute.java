package io.github.shangor.gateway.route;

import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.handler.GatewayResponses;
import io.github.shangor.gateway.intercept.InterceptorRules;
import io.github.shangor.gateway.rewrite.MimeTypes;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves the browser-side interception shims with the classifier's rules
 * baked in.
 */
class StaticAssetRoute implements Route {
    static final String SERVICE_WORKER = "/sw.js";
    static final String INTERCEPT_SCRIPT = "/gateway/intercept.js";
    static final String NAVIGATE_SCRIPT = "/gateway/navigate.js";

    private static final Map<String, String> ASSETS = Map.of(
            SERVICE_WORKER, "static/sw.js",
            INTERCEPT_SCRIPT, "static/intercept.js",
            NAVIGATE_SCRIPT, "static/navigate.js");

    private final Map<String, String> published = new ConcurrentHashMap<>();

    @Override
    public boolean matches(GatewayRequest request) {
        return HttpMethod.GET.equals(request.method()) && ASSETS.containsKey(request.path());
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(GatewayRequest request) {
        String path = request.path();
        String script = published.computeIfAbsent(path,
                p -> InterceptorRules.publish(GatewayResponses.resource(ASSETS.get(p))));
        FullHttpResponse response = GatewayResponses.text(HttpResponseStatus.OK, MimeTypes.JAVASCRIPT, script);
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_CACHE);
        if (SERVICE_WORKER.equals(path)) {
            response.headers().set("Service-Worker-Allowed", "/");
        }
        return CompletableFuture.completedFuture(response);
    }
}
