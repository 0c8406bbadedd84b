package io.github.shangor.gateway.route;

import io.github.shangor.gateway.error.GatewayException;
import io.github.shangor.gateway.error.InvalidUrlException;
import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.handler.GatewayResponses;
import io.github.shangor.gateway.redirect.Resolution;
import io.github.shangor.gateway.rewrite.Injection;
import io.github.shangor.gateway.rewrite.RewriteMode;
import io.github.shangor.gateway.rewrite.RewrittenContent;
import io.github.shangor.gateway.rewrite.UrlRewriter;
import io.github.shangor.gateway.server.GatewayContext;
import io.github.shangor.gateway.session.VisitorSession;
import io.github.shangor.gateway.upstream.FetchOptions;
import io.github.shangor.gateway.upstream.FetchResult;
import io.github.shangor.gateway.util.Futures;
import io.github.shangor.gateway.util.Urls;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@code /navigate?url=}: a navigation away from the target site. The redirect
 * chain is collapsed on the server and the landing page is served in
 * navigation mode so further clicks come back here.
 */
class NavigateRoute extends UpstreamRoute {
    private static final Logger log = LoggerFactory.getLogger(NavigateRoute.class);

    NavigateRoute(GatewayContext context) {
        super(context);
    }

    @Override
    public boolean matches(GatewayRequest request) {
        return request.path().equals("/navigate")
                && (HttpMethod.GET.equals(request.method()) || HttpMethod.POST.equals(request.method()));
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(GatewayRequest request) {
        VisitorSession session = request.ensureSession();

        URI target;
        try {
            target = context.guard().check(navigationUrl(request));
        } catch (GatewayException e) {
            log.warn("Rejected navigation: {}", e.getMessage());
            return CompletableFuture.completedFuture(
                    GatewayResponses.errorPage(e.status(), "Navigation refused", e.getMessage()));
        }

        FetchOptions get = FetchOptions.defaults()
                .withHeader("Accept", request.header("Accept"))
                .withHeader("Accept-Language", request.header("Accept-Language"))
                .withFollowRedirects(false);

        CompletableFuture<Resolution> resolution;
        if (HttpMethod.POST.equals(request.method())) {
            FetchOptions post = forwarded(request).withFollowRedirects(false);
            resolution = context.fetcher().fetchWithRetry(target, session, post)
                    .thenCompose(first -> context.resolver().resolveFrom(first, session, get));
        } else {
            resolution = context.resolver().resolve(target, session, get);
        }

        return resolution
                .thenApply(r -> render(request, r))
                .exceptionally(failure -> {
                    Throwable cause = Futures.unwrap(failure);
                    log.warn("Navigation to {} failed: {}", target, cause.getMessage());
                    return GatewayResponses.errorPage(statusOf(cause), "Unable to open the page", cause.getMessage());
                });
    }

    private FullHttpResponse render(GatewayRequest request, Resolution resolution) {
        FetchResult response = resolution.response();
        if (log.isDebugEnabled())
            log.debug("Navigation ended at {} after {} fetches ({})", resolution.finalUrl(), resolution.fetches(), resolution.termination());

        if (resolution.termination() == Resolution.Termination.BLOCKED_TARGET) {
            return GatewayResponses.errorPage(HttpResponseStatus.FORBIDDEN, "Navigation refused",
                    "The page redirected to an address that cannot be opened.");
        }
        if (response.isRedirect()) {
            Optional<URI> next = Urls.resolve(response.url(), response.location());
            if (next.isPresent()) {
                return GatewayResponses.redirect(UrlRewriter.toNavigate(next.get().toString()));
            }
        }
        RewrittenContent content = context.rewriter().render(response, response.url().getRawPath(), accept(request),
                RewriteMode.NAVIGATION, Injection.body(NAVIGATE_TAG));
        return proxied(response, content);
    }

    /**
     * The {@code url} parameter, decoded once more when it arrived double encoded.
     */
    static String navigationUrl(GatewayRequest request) {
        String url = request.param("url").orElseThrow(() -> new InvalidUrlException(""));
        // Only a value that is not yet an absolute URL is decoded again, so escapes
        // inside a real URL (a%26b in a query) survive. A double-encoded value whose
        // target itself carried single escapes still loses them.
        if (url.contains("%") && !isAbsoluteHttp(url)) {
            try {
                url = Urls.decodeComponent(url);
            } catch (IllegalArgumentException e) {
                // a literal '%' in an already decoded URL
                if (log.isDebugEnabled())
                    log.debug("Keeping navigation URL as is: {}", e.getMessage());
            }
        }
        return url;
    }

    private static boolean isAbsoluteHttp(String url) {
        return url.regionMatches(true, 0, "http://", 0, 7) || url.regionMatches(true, 0, "https://", 0, 8);
    }
}
