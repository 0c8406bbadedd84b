package io.github.shangor.gateway.upstream;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.PrematureChannelClosureException;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Completes the pending exchange with the aggregated answer and closes the
 * connection. Every upstream connection carries exactly one exchange.
 */
class UpstreamResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
    private final URI url;
    private final CompletableFuture<FetchResult> result;

    UpstreamResponseHandler(URI url, CompletableFuture<FetchResult> result) {
        this.url = url;
        this.result = result;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
        byte[] body = ByteBufUtil.getBytes(response.content());
        var headers = new DefaultHttpHeaders().set(response.headers());
        result.complete(new FetchResult(response.status().code(), headers, body, url));
        ctx.close();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        result.completeExceptionally(cause);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!result.isDone()) {
            result.completeExceptionally(new PrematureChannelClosureException("upstream closed before answering " + url));
        }
        super.channelInactive(ctx);
    }
}
