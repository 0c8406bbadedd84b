package io.github.shangor.gateway.route;

import io.github.shangor.gateway.error.GatewayException;
import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.handler.GatewayResponses;
import io.github.shangor.gateway.intercept.InterceptorRules;
import io.github.shangor.gateway.rewrite.Injection;
import io.github.shangor.gateway.rewrite.MimeTypes;
import io.github.shangor.gateway.rewrite.RewriteMode;
import io.github.shangor.gateway.rewrite.RewrittenContent;
import io.github.shangor.gateway.rewrite.UrlRewriter;
import io.github.shangor.gateway.server.GatewayContext;
import io.github.shangor.gateway.session.VisitorSession;
import io.github.shangor.gateway.upstream.FetchOptions;
import io.github.shangor.gateway.upstream.FetchResult;
import io.github.shangor.gateway.util.Futures;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@code /browse*}: same-origin content of the target site, fetched with the
 * visit's cookie jar and served with the interception bootstrap injected.
 */
class BrowseRoute extends UpstreamRoute {
    private static final Logger log = LoggerFactory.getLogger(BrowseRoute.class);

    BrowseRoute(GatewayContext context) {
        super(context);
    }

    @Override
    public boolean matches(GatewayRequest request) {
        return Route.isUnder(request.path(), UrlRewriter.BROWSE_PREFIX);
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(GatewayRequest request) {
        Optional<VisitorSession> current = request.session();
        if (current.isEmpty()) {
            log.warn("No active visit for {}", request.path());
            return CompletableFuture.completedFuture(GatewayResponses.redirect("/"));
        }
        VisitorSession session = current.get();

        URI target;
        try {
            target = context.guard().check(targetUrl(request));
        } catch (GatewayException e) {
            return CompletableFuture.completedFuture(failure(request, e.status(), e));
        }

        FetchOptions options = forwarded(request)
                .withCookies(context.cookies().buildHeader(session))
                .withHeader("Referer", context.config().getTargetUrl().toString())
                .withRedirectListener(hop -> absorbFromTarget(hop, session));
        if (log.isDebugEnabled())
            log.debug("Browsing {} with credential {}", target, session.credentialId());

        return context.fetcher().fetchWithRetry(target, session, options)
                .thenApply(result -> {
                    absorbFromTarget(result, session);
                    RewrittenContent content = context.rewriter().render(result, request.path(), accept(request),
                            RewriteMode.BROWSE, Injection.head(bootstrap()));
                    return proxied(result, content);
                })
                .exceptionally(failure -> {
                    Throwable cause = Futures.unwrap(failure);
                    log.warn("Browse of {} failed: {}", target, cause.getMessage());
                    return failure(request, HttpResponseStatus.BAD_GATEWAY, cause);
                });
    }

    /**
     * The target URL a browse path stands for: target origin, the path after
     * {@code /browse}, and the untouched query string.
     */
    String targetUrl(GatewayRequest request) {
        String path = request.rawPath().substring(UrlRewriter.BROWSE_PREFIX.length());
        if (path.isEmpty()) {
            path = "/";
        }
        String query = request.rawQuery();
        return context.config().getTargetBase() + path + (query == null || query.isEmpty() ? "" : "?" + query);
    }

    /**
     * The jar belongs to the target site: cookies set by other hosts along a
     * redirect chain are not kept.
     */
    private void absorbFromTarget(FetchResult answer, VisitorSession session) {
        String host = answer.url() == null ? null : answer.url().getHost();
        if (host != null && host.equalsIgnoreCase(context.config().getTargetUrl().getHost())) {
            context.cookies().absorb(answer.headers(), session);
        } else if (log.isDebugEnabled()) {
            log.debug("Ignoring cookies set by {}", host);
        }
    }

    private String bootstrap() {
        return InterceptorRules.configScript(context.config().getTargetUrl().toString(), context.config().getTargetBase())
                + INTERCEPT_TAG;
    }

    private FullHttpResponse failure(GatewayRequest request, HttpResponseStatus status, Throwable cause) {
        if (MimeTypes.isSubResource(request.path(), accept(request))) {
            HttpResponseStatus sub = status == HttpResponseStatus.BAD_GATEWAY ? HttpResponseStatus.NOT_FOUND : status;
            return GatewayResponses.withCors(GatewayResponses.empty(sub, MimeTypes.forPath(request.path())));
        }
        return GatewayResponses.errorPage(status, "Unable to load the page", cause.getMessage());
    }
}
