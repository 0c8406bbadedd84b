package io.github.shangor.gateway.upstream.tunnel;

import io.github.shangor.gateway.upstream.UpstreamCredential;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

public class TunnelInitializer extends ChannelInitializer<SocketChannel> {
    private static final int MAX_REQUEST_SIZE = 10 * 1024 * 1024;

    private final UpstreamCredential credential;
    private final int connectTimeoutMillis;
    private final ChannelGroup clients;

    public TunnelInitializer(UpstreamCredential credential, int connectTimeoutMillis, ChannelGroup clients) {
        this.credential = credential;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.clients = clients;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        clients.add(ch);
        ch.pipeline()
                .addLast(new HttpServerCodec())
                .addLast(new HttpObjectAggregator(MAX_REQUEST_SIZE))
                .addLast(new TunnelFrontendHandler(credential, connectTimeoutMillis));
    }
}
