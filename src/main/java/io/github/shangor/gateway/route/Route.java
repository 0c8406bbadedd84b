package io.github.shangor.gateway.route;

import io.github.shangor.gateway.handler.GatewayRequest;
import io.netty.handler.codec.http.FullHttpResponse;

import java.util.concurrent.CompletableFuture;

/**
 * One entry point of the gateway's HTTP surface.
 */
public interface Route {

    boolean matches(GatewayRequest request);

    /**
     * Produces the response. Failures a route knows how to present are mapped
     * inside the returned future; anything else fails it.
     */
    CompletableFuture<FullHttpResponse> handle(GatewayRequest request);

    static boolean isUnder(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }
}
