package io.github.shangor.gateway.route;

import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.handler.GatewayResponses;
import io.github.shangor.gateway.session.VisitorSession;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * {@code GET /}, {@code POST /proceed} and {@code GET /reset}: starting and
 * ending a visit.
 */
class LandingRoute implements Route {
    private static final Logger log = LoggerFactory.getLogger(LandingRoute.class);

    @Override
    public boolean matches(GatewayRequest request) {
        String path = request.path();
        return path.equals("/") || path.equals("/proceed") || path.equals("/reset");
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(GatewayRequest request) {
        return CompletableFuture.completedFuture(switch (request.path()) {
            case "/proceed" -> proceed(request);
            case "/reset" -> reset(request);
            default -> landing(request);
        });
    }

    private FullHttpResponse landing(GatewayRequest request) {
        if (!HttpMethod.GET.equals(request.method()) && !HttpMethod.HEAD.equals(request.method())) {
            return GatewayResponses.errorPage(HttpResponseStatus.METHOD_NOT_ALLOWED, "Not Allowed", "Use the proceed button to continue.");
        }
        if (request.session().isPresent()) {
            return GatewayResponses.redirect("/browse");
        }
        return GatewayResponses.html(HttpResponseStatus.OK, GatewayResponses.resource("templates/landing.html"));
    }

    private FullHttpResponse proceed(GatewayRequest request) {
        if (!HttpMethod.POST.equals(request.method())) {
            return GatewayResponses.redirect("/");
        }
        VisitorSession session = request.startSession();
        log.info("Visit started with credential {}", session.credentialId());
        return GatewayResponses.redirect("/browse");
    }

    private FullHttpResponse reset(GatewayRequest request) {
        request.resetSession();
        return GatewayResponses.redirect("/");
    }
}
