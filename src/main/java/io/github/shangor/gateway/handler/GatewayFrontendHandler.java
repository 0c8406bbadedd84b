package io.github.shangor.gateway.handler;

import io.github.shangor.gateway.error.GatewayException;
import io.github.shangor.gateway.route.Router;
import io.github.shangor.gateway.server.GatewayContext;
import io.github.shangor.gateway.session.VisitorSession;
import io.github.shangor.gateway.util.Futures;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.cookie.CookieHeaderNames;
import io.netty.handler.codec.http.cookie.DefaultCookie;
import io.netty.handler.codec.http.cookie.ServerCookieEncoder;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Browser-facing handler: turns each aggregated request into a
 * {@link GatewayRequest}, dispatches it and writes the response once the
 * route's future completes, on the channel's event loop.
 */
public class GatewayFrontendHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger log = LoggerFactory.getLogger(GatewayFrontendHandler.class);
    private static final AtomicLong requestCounter = new AtomicLong(0);
    private static final long SLOW_REQUEST_MILLIS = 1000;

    private final GatewayContext context;
    private final Router router;

    public GatewayFrontendHandler(GatewayContext context, Router router) {
        this.context = context;
        this.router = router;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        long startTime = System.currentTimeMillis();
        long requestId = requestCounter.incrementAndGet();
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        GatewayRequest gatewayRequest = GatewayRequest.from(request, context.sessions());
        if (log.isDebugEnabled())
            log.debug("Request #{}: {}", requestId, gatewayRequest);

        router.dispatch(gatewayRequest).whenComplete((response, failure) -> ctx.executor().execute(() -> {
            FullHttpResponse out = failure == null ? response : failureResponse(gatewayRequest, Futures.unwrap(failure));
            write(ctx, gatewayRequest, out, keepAlive);
            long duration = System.currentTimeMillis() - startTime;
            if (duration > SLOW_REQUEST_MILLIS) {
                log.warn("Slow request #{}: {} ms for {}", requestId, duration, gatewayRequest);
            }
        }));
    }

    private void write(ChannelHandlerContext ctx, GatewayRequest request, FullHttpResponse response, boolean keepAlive) {
        if (!ctx.channel().isActive()) {
            response.release();
            return;
        }
        applySessionCookie(request, response);
        HttpUtil.setContentLength(response, response.content().readableBytes());
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    private void applySessionCookie(GatewayRequest request, FullHttpResponse response) {
        DefaultCookie cookie;
        if (request.issueCookie()) {
            VisitorSession session = request.currentSession();
            cookie = new DefaultCookie(GatewayRequest.SESSION_COOKIE, session.sessionId());
            cookie.setMaxAge(context.config().getSessionTtl().getSeconds());
        } else if (request.clearCookie()) {
            cookie = new DefaultCookie(GatewayRequest.SESSION_COOKIE, "");
            cookie.setMaxAge(0);
        } else {
            return;
        }
        cookie.setPath("/");
        cookie.setHttpOnly(true);
        cookie.setSameSite(CookieHeaderNames.SameSite.Lax);
        cookie.setSecure(context.config().isSecureCookies());
        response.headers().add(HttpHeaderNames.SET_COOKIE, ServerCookieEncoder.STRICT.encode(cookie));
    }

    /**
     * Failures no route mapped itself: gateway errors keep their status,
     * connect failures are 502 and timeouts 504.
     */
    static FullHttpResponse failureResponse(GatewayRequest request, Throwable cause) {
        if (cause instanceof GatewayException ge) {
            log.warn("{} failed: {}", request, ge.getMessage());
            return GatewayResponses.errorPage(ge.status(), ge.status().reasonPhrase(), ge.getMessage());
        } else if (cause instanceof ConnectException) {
            log.warn("Connection failed: {}", cause.getMessage());
            return GatewayResponses.errorPage(HttpResponseStatus.BAD_GATEWAY, "Bad Gateway", cause.getMessage());
        } else if (cause instanceof TimeoutException) {
            log.warn("Request timeout: {}", request);
            return GatewayResponses.errorPage(HttpResponseStatus.GATEWAY_TIMEOUT, "Gateway Timeout", "The site took too long to answer.");
        }
        log.error("Unexpected failure for {}", request, cause);
        return GatewayResponses.errorPage(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Server Error",
                "An unexpected error occurred. Please try again later.");
    }

    private void sendError(ChannelHandlerContext ctx, HttpResponseStatus status) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status, Unpooled.copiedBuffer("Gateway Error: " + status + "\r\n", CharsetUtil.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ClosedChannelException) {
            if (log.isDebugEnabled())
                log.debug("Channel closed: {}", cause.getMessage());
            ctx.close();
        } else if (cause instanceof GatewayException ge) {
            log.warn("Rejected request: {}", ge.getMessage());
            sendError(ctx, ge.status());
        } else {
            log.error("Unexpected exception in frontend handler: {}", cause.getMessage());
            if (log.isDebugEnabled())
                log.debug("Stack trace:", cause);
            sendError(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR);
        }
    }
}
