package io.github.shangor.gateway.server;

import io.github.shangor.gateway.handler.GatewayFrontendHandler;
import io.github.shangor.gateway.route.Router;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpContentCompressor;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

public class GatewayInitializer extends ChannelInitializer<SocketChannel> {

    private final GatewayContext context;
    private final Router router;

    public GatewayInitializer(GatewayContext context, Router router) {
        this.context = context;
        this.router = router;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ch.pipeline().addLast(
                new HttpServerCodec(),
                new HttpObjectAggregator(context.config().getMaxContentLength()),
                new HttpContentCompressor(),
                new GatewayFrontendHandler(context, router)
        );
    }
}
