package io.github.shangor.gateway.upstream.tunnel;

import io.github.shangor.gateway.upstream.UpstreamCredential;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A loopback HTTP proxy bound to an ephemeral port that forwards everything
 * through one SOCKS5 credential. HTTPS fetches use it as their CONNECT proxy
 * so TLS runs end to end with the target while the exit IP stays pinned.
 */
public final class UpstreamTunnel implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UpstreamTunnel.class);

    private final String credentialId;
    private final Channel serverChannel;
    private final ChannelGroup clients;
    private final Instant createdAt;

    private UpstreamTunnel(String credentialId, Channel serverChannel, ChannelGroup clients) {
        this.credentialId = credentialId;
        this.serverChannel = serverChannel;
        this.clients = clients;
        this.createdAt = Instant.now();
    }

    public static CompletableFuture<UpstreamTunnel> open(EventLoopGroup group, UpstreamCredential credential,
                                                         int connectTimeoutMillis) {
        ChannelGroup clients = new DefaultChannelGroup("tunnel-" + credential.credentialId(), GlobalEventExecutor.INSTANCE);
        ServerBootstrap b = new ServerBootstrap();
        b.group(group)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new TunnelInitializer(credential, connectTimeoutMillis, clients));

        CompletableFuture<UpstreamTunnel> opened = new CompletableFuture<>();
        b.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0)).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                UpstreamTunnel tunnel = new UpstreamTunnel(credential.credentialId(), f.channel(), clients);
                log.info("Tunnel {} listening on {} via {}", credential.credentialId(), tunnel.localEndpoint(), credential);
                opened.complete(tunnel);
            } else {
                opened.completeExceptionally(f.cause());
            }
        });
        return opened;
    }

    public String credentialId() {
        return credentialId;
    }

    public InetSocketAddress localEndpoint() {
        return (InetSocketAddress) serverChannel.localAddress();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isOpen() {
        return serverChannel.isOpen();
    }

    @Override
    public void close() {
        if (serverChannel.isOpen()) {
            log.info("Closing tunnel {} ({} open connections)", credentialId, clients.size());
        }
        serverChannel.close();
        clients.close();
    }
}
