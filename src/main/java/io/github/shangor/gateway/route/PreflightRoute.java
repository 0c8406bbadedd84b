package io.github.shangor.gateway.route;

import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.handler.GatewayResponses;
import io.github.shangor.gateway.rewrite.UrlRewriter;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;

import java.util.concurrent.CompletableFuture;

/**
 * CORS preflight for the proxied and relay paths.
 */
class PreflightRoute implements Route {

    @Override
    public boolean matches(GatewayRequest request) {
        if (!HttpMethod.OPTIONS.equals(request.method())) {
            return false;
        }
        String path = request.path();
        return Route.isUnder(path, UrlRewriter.BROWSE_PREFIX) || path.startsWith(UrlRewriter.EXTERNAL_PREFIX) || path.equals("/relay");
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(GatewayRequest request) {
        return CompletableFuture.completedFuture(GatewayResponses.preflight());
    }
}
