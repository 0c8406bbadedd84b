package io.github.shangor.gateway.route;

import io.github.shangor.gateway.error.GatewayException;
import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.handler.GatewayResponses;
import io.github.shangor.gateway.rewrite.Injection;
import io.github.shangor.gateway.rewrite.MimeTypes;
import io.github.shangor.gateway.rewrite.RewriteMode;
import io.github.shangor.gateway.rewrite.RewrittenContent;
import io.github.shangor.gateway.rewrite.UrlRewriter;
import io.github.shangor.gateway.server.GatewayContext;
import io.github.shangor.gateway.session.VisitorSession;
import io.github.shangor.gateway.util.Futures;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@code /external/<encoded url>}: a cross-origin resource or frame, fetched
 * through the visit's upstream without the target site's cookies.
 */
class ExternalRoute extends UpstreamRoute {
    private static final Logger log = LoggerFactory.getLogger(ExternalRoute.class);

    ExternalRoute(GatewayContext context) {
        super(context);
    }

    @Override
    public boolean matches(GatewayRequest request) {
        return request.rawPath().startsWith(UrlRewriter.EXTERNAL_PREFIX);
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(GatewayRequest request) {
        Optional<VisitorSession> current = request.session();
        if (current.isEmpty()) {
            log.warn("No active visit for external request");
            return CompletableFuture.completedFuture(GatewayResponses.redirect("/"));
        }
        VisitorSession session = current.get();

        URI target;
        try {
            target = context.guard().check(externalUrl(request));
        } catch (GatewayException e) {
            log.warn("Rejected external target: {}", e.getMessage());
            return CompletableFuture.completedFuture(failure(request, null, e.status(), e));
        }

        return context.fetcher().fetchWithRetry(target, session, forwarded(request))
                .thenApply(result -> {
                    RewrittenContent content = context.rewriter().render(result, target.getRawPath(), accept(request),
                            RewriteMode.NAVIGATION, Injection.body(NAVIGATE_TAG));
                    return proxied(result, content);
                })
                .exceptionally(failure -> {
                    Throwable cause = Futures.unwrap(failure);
                    log.warn("External fetch of {} failed: {}", target, cause.getMessage());
                    return failure(request, target, HttpResponseStatus.BAD_GATEWAY, cause);
                });
    }

    /**
     * Decodes the path segment back to the absolute URL. A query string sent
     * next to an unencoded URL belongs to that URL.
     */
    static String externalUrl(GatewayRequest request) {
        String encoded = request.rawPath().substring(UrlRewriter.EXTERNAL_PREFIX.length());
        String url = UrlRewriter.decodeExternal(encoded);
        String query = request.rawQuery();
        return query == null || query.isEmpty() ? url : url + "?" + query;
    }

    private FullHttpResponse failure(GatewayRequest request, URI target, HttpResponseStatus status, Throwable cause) {
        if (HttpMethod.POST.equals(request.method())) {
            return GatewayResponses.withCors(GatewayResponses.jsonError(status, "External request failed", cause.getMessage()));
        }
        String path = target == null ? request.path() : target.getRawPath();
        HttpResponseStatus empty = status == HttpResponseStatus.BAD_GATEWAY ? HttpResponseStatus.NOT_FOUND : status;
        return GatewayResponses.withCors(GatewayResponses.empty(empty, MimeTypes.forPath(path == null ? "" : path)));
    }
}
