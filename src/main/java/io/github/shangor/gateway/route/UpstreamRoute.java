package io.github.shangor.gateway.route;

import io.github.shangor.gateway.error.GatewayException;
import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.handler.GatewayResponses;
import io.github.shangor.gateway.rewrite.RewrittenContent;
import io.github.shangor.gateway.server.GatewayContext;
import io.github.shangor.gateway.upstream.FetchOptions;
import io.github.shangor.gateway.upstream.FetchResult;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Shared plumbing of the routes that fetch through the upstream.
 */
abstract class UpstreamRoute implements Route {
    static final String INTERCEPT_TAG = "<script src=\"" + StaticAssetRoute.INTERCEPT_SCRIPT + "\"></script>";
    static final String NAVIGATE_TAG = "<script src=\"" + StaticAssetRoute.NAVIGATE_SCRIPT + "\"></script>";

    protected final GatewayContext context;

    protected UpstreamRoute(GatewayContext context) {
        this.context = context;
    }

    /**
     * Method, body and the content negotiation headers of the browser request.
     */
    protected FetchOptions forwarded(GatewayRequest request) {
        FetchOptions options = FetchOptions.defaults()
                .withHeader("Accept", request.header(HttpHeaderNames.ACCEPT))
                .withHeader("Accept-Language", request.header(HttpHeaderNames.ACCEPT_LANGUAGE));
        if (HttpMethod.POST.equals(request.method())) {
            options = options.withMethod(HttpMethod.POST)
                    .withBody(request.body())
                    .withHeader("Content-Type", request.header(HttpHeaderNames.CONTENT_TYPE));
        }
        return options;
    }

    protected String accept(GatewayRequest request) {
        return request.headers().get(HttpHeaderNames.ACCEPT, "");
    }

    protected static FullHttpResponse proxied(FetchResult result, RewrittenContent content) {
        FullHttpResponse response = GatewayResponses.bytes(HttpResponseStatus.valueOf(result.status()),
                content.contentType(), content.body());
        String cacheControl = result.headers().get(HttpHeaderNames.CACHE_CONTROL);
        if (cacheControl != null) {
            response.headers().set(HttpHeaderNames.CACHE_CONTROL, cacheControl);
        }
        return GatewayResponses.withCors(response);
    }

    protected static HttpResponseStatus statusOf(Throwable failure) {
        return failure instanceof GatewayException ge ? ge.status() : HttpResponseStatus.BAD_GATEWAY;
    }
}
