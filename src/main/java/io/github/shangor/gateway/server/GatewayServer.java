package io.github.shangor.gateway.server;

import io.github.shangor.gateway.config.GatewayConfig;
import io.github.shangor.gateway.route.Router;
import io.github.shangor.gateway.upstream.NettyUpstreamClient;
import io.github.shangor.gateway.upstream.tunnel.TunnelRegistry;
import io.github.shangor.gateway.upstream.tunnel.UpstreamTunnel;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

public class GatewayServer {
    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);
    private static final long SWEEP_INTERVAL_SECONDS = 60;

    private final GatewayConfig config;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private GatewayContext context;
    private NettyUpstreamClient client;
    private ScheduledFuture<?> sweeper;
    private Channel serverChannel;

    public GatewayServer(GatewayConfig config) {
        this.config = config;
    }

    /**
     * Binds the gateway and blocks until its channel closes.
     */
    public void start() throws Exception {
        var factory = NioIoHandler.newFactory();
        bossGroup = new MultiThreadIoEventLoopGroup(1, factory);
        workerGroup = new MultiThreadIoEventLoopGroup(factory);

        try {
            int connectTimeout = config.getConnectTimeoutMillis();
            TunnelRegistry tunnels = new TunnelRegistry(
                    credential -> UpstreamTunnel.open(workerGroup, credential, connectTimeout));
            client = new NettyUpstreamClient(workerGroup, tunnels, connectTimeout,
                    config.getRequestTimeoutMillis(), config.getMaxContentLength());
            context = GatewayContext.create(config, client, tunnels, workerGroup);
            sweeper = workerGroup.scheduleAtFixedRate(this::sweep, SWEEP_INTERVAL_SECONDS, SWEEP_INTERVAL_SECONDS, TimeUnit.SECONDS);

            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new GatewayInitializer(context, Router.standard(context)));

            serverChannel = b.bind(config.getPort()).sync().channel();
            log.info("Gateway for {} started on port {}, upstream {}", config.getTargetUrl(), config.getPort(), config.getUpstream());

            serverChannel.closeFuture().sync();
        } finally {
            stop();
        }
    }

    private void sweep() {
        int removed = context.sessions().expireIdle();
        if (removed > 0) {
            log.info("Expired {} idle sessions, {} tunnels open", removed, context.tunnels().size());
        }
    }

    public void stop() {
        if (sweeper != null) {
            sweeper.cancel(false);
        }
        if (serverChannel != null) {
            serverChannel.close();
        }
        if (context != null) {
            context.sessions().destroyAll();
            context.tunnels().closeAll();
        }
        if (client != null) {
            client.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        log.info("Gateway stopped");
    }
}
