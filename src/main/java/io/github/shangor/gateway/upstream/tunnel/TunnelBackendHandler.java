package io.github.shangor.gateway.upstream.tunnel;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands a plain-HTTP answer received through SOCKS5 back to the tunnel client.
 * One request per outbound connection; the outbound side is closed after the answer.
 */
public class TunnelBackendHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
    private static final Logger log = LoggerFactory.getLogger(TunnelBackendHandler.class);

    private final Channel inboundChannel;

    public TunnelBackendHandler(Channel inboundChannel) {
        this.inboundChannel = inboundChannel;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
        response.retain();
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        inboundChannel.writeAndFlush(response).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to hand answer back to tunnel client", future.cause());
            }
            ctx.close();
            RelayHandler.closeOnFlush(inboundChannel);
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Tunnel backend error: {}", cause.getMessage());
        ctx.close();
        RelayHandler.closeOnFlush(inboundChannel);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        RelayHandler.closeOnFlush(inboundChannel);
    }
}
