package io.github.shangor.gateway.route;

import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.handler.GatewayResponses;
import io.github.shangor.gateway.server.GatewayContext;
import io.netty.handler.codec.http.FullHttpResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatches to the first matching route, in registration order.
 */
public class Router {
    private final List<Route> routes;

    public Router(List<Route> routes) {
        this.routes = List.copyOf(routes);
    }

    public static Router standard(GatewayContext context) {
        return new Router(List.of(
                new PreflightRoute(),
                new LandingRoute(),
                new StaticAssetRoute(),
                new RelayRoute(context),
                new NavigateRoute(context),
                new ExternalRoute(context),
                new BrowseRoute(context)));
    }

    public CompletableFuture<FullHttpResponse> dispatch(GatewayRequest request) {
        for (Route route : routes) {
            if (route.matches(request)) {
                try {
                    return route.handle(request);
                } catch (RuntimeException e) {
                    return CompletableFuture.failedFuture(e);
                }
            }
        }
        return CompletableFuture.completedFuture(GatewayResponses.notFound());
    }

    List<Route> routes() {
        return routes;
    }
}
