package io.github.shangor.gateway.upstream.tunnel;

import io.github.shangor.gateway.upstream.UpstreamCredential;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.proxy.Socks5ProxyHandler;
import io.netty.resolver.NoopAddressResolverGroup;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * Accepts CONNECT and absolute-form HTTP requests on the tunnel's loopback
 * port and forwards them through the SOCKS5 credential. Target names are
 * resolved by the upstream, never locally.
 */
public class TunnelFrontendHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger log = LoggerFactory.getLogger(TunnelFrontendHandler.class);

    public static final Pattern URI_PATTERN = Pattern.compile("^((?<scheme>https?)://)?(?<host>[a-zA-Z0-9._-]+)(:(?<port>[0-9]+))?(?<rest>/.*)?$");

    private final UpstreamCredential credential;
    private final int connectTimeoutMillis;
    private Channel outboundChannel;

    public TunnelFrontendHandler(UpstreamCredential credential, int connectTimeoutMillis) {
        this.credential = credential;
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public static URI parseUri(String uri, int defaultPort) throws URISyntaxException {
        var matcher = URI_PATTERN.matcher(uri);
        if (matcher.matches()) {
            var scheme = matcher.group("scheme");
            var host = matcher.group("host");
            var portStr = matcher.group("port");
            var rest = matcher.group("rest");

            var port = portStr != null ? Integer.parseInt(portStr) : defaultPort;
            return new URI((scheme != null ? scheme : "http") + "://" + host + ":" + port + (rest != null ? rest : "/"));
        } else {
            throw new URISyntaxException(uri, "Invalid proxy request target");
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        try {
            if (HttpMethod.CONNECT.equals(request.method())) {
                URI uri = parseUri(request.uri(), 443);
                if (log.isDebugEnabled())
                    log.debug("Tunnel {} CONNECT {}:{}", credential.credentialId(), uri.getHost(), uri.getPort());
                connectForHttps(ctx, uri.getHost(), uri.getPort());
            } else {
                URI uri = parseUri(request.uri(), 80);
                if (log.isDebugEnabled())
                    log.debug("Tunnel {} forwarding {} {}", credential.credentialId(), request.method(), uri);
                request.retain();
                forwardHttp(ctx, request, uri);
            }
        } catch (URISyntaxException e) {
            log.warn("Tunnel {} rejected request target {}", credential.credentialId(), request.uri());
            sendError(ctx, HttpResponseStatus.BAD_REQUEST);
        }
    }

    private void connectForHttps(ChannelHandlerContext ctx, String host, int port) {
        Socks5ProxyHandler socks = newSocksHandler();
        Bootstrap b = createBootstrap(ctx, socks, new HandshakeFailureHandler());

        b.connect(InetSocketAddress.createUnresolved(host, port)).addListener((ChannelFutureListener) tcp -> {
            if (!tcp.isSuccess()) {
                log.warn("Tunnel {} could not reach upstream {}: {}", credential.credentialId(), credential, tcp.cause().getMessage());
                sendError(ctx, HttpResponseStatus.BAD_GATEWAY);
                return;
            }
            socks.connectFuture().addListener(handshake -> {
                if (!handshake.isSuccess()) {
                    log.warn("Tunnel {} SOCKS5 handshake for {}:{} failed: {}", credential.credentialId(), host, port,
                            handshake.cause().getMessage());
                    sendError(ctx, HttpResponseStatus.BAD_GATEWAY);
                    return;
                }
                Channel outbound = tcp.channel();
                this.outboundChannel = outbound;
                FullHttpResponse established = new DefaultFullHttpResponse(
                        HttpVersion.HTTP_1_1, new HttpResponseStatus(200, "Connection Established"));
                ctx.writeAndFlush(established).addListener((ChannelFutureListener) written -> {
                    if (!written.isSuccess()) {
                        RelayHandler.closeOnFlush(outbound);
                        RelayHandler.closeOnFlush(ctx.channel());
                        return;
                    }
                    // switch both sides to raw byte relay
                    ChannelPipeline clientPipeline = ctx.pipeline();
                    clientPipeline.remove(HttpServerCodec.class);
                    clientPipeline.remove(HttpObjectAggregator.class);
                    clientPipeline.addLast(new RelayHandler(outbound));
                    clientPipeline.remove(this);

                    ChannelPipeline serverPipeline = outbound.pipeline();
                    serverPipeline.remove(HandshakeFailureHandler.class);
                    serverPipeline.addLast(new RelayHandler(ctx.channel()));
                });
            });
        });
    }

    private void forwardHttp(ChannelHandlerContext ctx, FullHttpRequest request, URI uri) {
        Socks5ProxyHandler socks = newSocksHandler();
        Bootstrap b = createBootstrap(ctx, socks, new HttpClientCodec(),
                new HttpObjectAggregator(Integer.MAX_VALUE), new TunnelBackendHandler(ctx.channel()));

        request.setUri(uri.getRawPath() + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : ""));
        request.headers().set(HttpHeaderNames.HOST, uri.getPort() == 80 ? uri.getHost() : uri.getHost() + ":" + uri.getPort());
        request.headers().remove(HttpHeaderNames.PROXY_AUTHORIZATION);
        request.headers().remove("Proxy-Connection");
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);

        ChannelFuture connect = b.connect(InetSocketAddress.createUnresolved(uri.getHost(), uri.getPort()));
        this.outboundChannel = connect.channel();
        connect.addListener((ChannelFutureListener) tcp -> {
            if (!tcp.isSuccess()) {
                log.warn("Tunnel {} could not reach upstream {}: {}", credential.credentialId(), credential, tcp.cause().getMessage());
                request.release();
                sendError(ctx, HttpResponseStatus.BAD_GATEWAY);
                return;
            }
            // ProxyHandler buffers the write until the SOCKS5 handshake completes
            tcp.channel().writeAndFlush(request).addListener((ChannelFutureListener) sent -> {
                if (!sent.isSuccess()) {
                    log.warn("Tunnel {} failed to send request to {}: {}", credential.credentialId(), uri.getHost(),
                            sent.cause().getMessage());
                    sendError(ctx, HttpResponseStatus.BAD_GATEWAY);
                }
            });
        });
    }

    private Socks5ProxyHandler newSocksHandler() {
        Socks5ProxyHandler handler = credential.hasAuth()
                ? new Socks5ProxyHandler(credential.proxyAddress(), credential.username(), credential.password())
                : new Socks5ProxyHandler(credential.proxyAddress());
        handler.setConnectTimeoutMillis(connectTimeoutMillis);
        return handler;
    }

    private Bootstrap createBootstrap(ChannelHandlerContext ctx, ChannelHandler... handlers) {
        Bootstrap b = new Bootstrap();
        b.group(ctx.channel().eventLoop())
                .channel(NioSocketChannel.class)
                .resolver(NoopAddressResolverGroup.INSTANCE)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(handlers);
                    }
                });
        return b;
    }

    private void sendError(ChannelHandlerContext ctx, HttpResponseStatus status) {
        if (!ctx.channel().isActive()) {
            return;
        }
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status, Unpooled.copiedBuffer("Tunnel Error: " + status + "\r\n", CharsetUtil.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Tunnel {} client error: {}", credential.credentialId(), cause.getMessage());
        RelayHandler.closeOnFlush(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (outboundChannel != null) {
            RelayHandler.closeOnFlush(outboundChannel);
            outboundChannel = null;
        }
    }

    /**
     * Swallows the failure the proxy handler fires when the SOCKS5 handshake
     * fails; the CONNECT answer is produced from the connect future instead.
     */
    private static final class HandshakeFailureHandler extends ChannelInboundHandlerAdapter {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (log.isDebugEnabled())
                log.debug("Outbound tunnel leg failed: {}", cause.getMessage());
            ctx.close();
        }
    }
}
