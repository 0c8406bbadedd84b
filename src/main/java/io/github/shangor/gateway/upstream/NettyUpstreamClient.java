package io.github.shangor.gateway.upstream;

import io.github.shangor.gateway.upstream.tunnel.TunnelRegistry;
import io.github.shangor.gateway.upstream.tunnel.UpstreamTunnel;
import io.github.shangor.gateway.util.Urls;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContentDecompressor;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.proxy.HttpProxyHandler;
import io.netty.handler.proxy.ProxyHandler;
import io.netty.handler.proxy.Socks5ProxyHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.resolver.NoopAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link UpstreamClient} on Netty. HTTPS goes through the credential's local
 * {@link UpstreamTunnel} with an HTTP CONNECT; plain HTTP goes straight through
 * the SOCKS5 credential. Host names are always resolved on the upstream side.
 */
public class NettyUpstreamClient implements UpstreamClient {
    private static final Logger log = LoggerFactory.getLogger(NettyUpstreamClient.class);

    static final Map<String, String> BROWSER_HEADERS = Map.of(
            "User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,image/apng,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.9",
            "Cache-Control", "no-cache",
            "Pragma", "no-cache");

    private final EventLoopGroup group;
    private final TunnelRegistry tunnels;
    private final SslContext sslContext;
    private final int connectTimeoutMillis;
    private final int requestTimeoutMillis;
    private final int maxContentLength;

    public NettyUpstreamClient(EventLoopGroup group, TunnelRegistry tunnels,
                               int connectTimeoutMillis, int requestTimeoutMillis, int maxContentLength) {
        this.group = group;
        this.tunnels = tunnels;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.requestTimeoutMillis = requestTimeoutMillis;
        this.maxContentLength = maxContentLength;
        try {
            this.sslContext = SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Cannot build client TLS context", e);
        }
    }

    @Override
    public CompletableFuture<FetchResult> execute(FetchRequest request, UpstreamCredential credential) {
        boolean https = "https".equalsIgnoreCase(request.url().getScheme());
        if (https) {
            return tunnels.acquire(credential)
                    .thenCompose(tunnel -> exchange(request, new HttpProxyHandler(tunnel.localEndpoint()), true));
        }
        ProxyHandler socks = credential.hasAuth()
                ? new Socks5ProxyHandler(credential.proxyAddress(), credential.username(), credential.password())
                : new Socks5ProxyHandler(credential.proxyAddress());
        return exchange(request, socks, false);
    }

    private CompletableFuture<FetchResult> exchange(FetchRequest request, ProxyHandler proxyHandler, boolean tls) {
        URI url = request.url();
        String host = url.getHost();
        int port = Urls.effectivePort(url);
        proxyHandler.setConnectTimeoutMillis(connectTimeoutMillis);

        CompletableFuture<FetchResult> result = new CompletableFuture<>();
        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .resolver(NoopAddressResolverGroup.INSTANCE)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(proxyHandler);
                        if (tls) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpContentDecompressor());
                        p.addLast(new HttpObjectAggregator(maxContentLength));
                        p.addLast(new UpstreamResponseHandler(url, result));
                    }
                });

        if (log.isDebugEnabled())
            log.debug("Upstream {} via {}", request, proxyHandler.proxyAddress());

        ChannelFuture connect = b.connect(InetSocketAddress.createUnresolved(host, port));
        Channel channel = connect.channel();
        connect.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                result.completeExceptionally(f.cause());
                return;
            }
            // the proxy handler holds this write until its handshake is done
            f.channel().writeAndFlush(toNettyRequest(request)).addListener((ChannelFutureListener) w -> {
                if (!w.isSuccess()) {
                    result.completeExceptionally(w.cause());
                    w.channel().close();
                }
            });
        });
        // the timeout belongs to this exchange so it closes this channel below
        result.orTimeout(requestTimeoutMillis, TimeUnit.MILLISECONDS);
        // a timed-out or otherwise abandoned exchange must not keep its connection
        result.whenComplete((r, failure) -> {
            if (failure != null && channel.isOpen()) {
                channel.close();
            }
        });
        return result;
    }

    static FullHttpRequest toNettyRequest(FetchRequest request) {
        URI url = request.url();
        var content = request.hasBody() ? Unpooled.wrappedBuffer(request.body()) : Unpooled.EMPTY_BUFFER;
        FullHttpRequest out = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, request.method(), Urls.requestTarget(url), content);
        HttpHeaders headers = out.headers();
        BROWSER_HEADERS.forEach(headers::set);
        headers.set(request.headers());
        int port = Urls.effectivePort(url);
        boolean defaultPort = ("https".equalsIgnoreCase(url.getScheme()) && port == 443)
                || ("http".equalsIgnoreCase(url.getScheme()) && port == 80);
        headers.set(HttpHeaderNames.HOST, defaultPort ? url.getHost() : url.getHost() + ":" + port);
        headers.set(HttpHeaderNames.ACCEPT_ENCODING, "gzip, deflate");
        headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        if (request.hasBody()) {
            headers.setInt(HttpHeaderNames.CONTENT_LENGTH, request.body().length);
        } else {
            headers.remove(HttpHeaderNames.CONTENT_LENGTH);
        }
        return out;
    }
}
