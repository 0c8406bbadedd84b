package io.github.shangor.gateway.upstream;

import io.github.shangor.gateway.util.Futures;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.PrematureChannelClosureException;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.proxy.ProxyConnectException;
import io.netty.handler.timeout.TimeoutException;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.nio.channels.ClosedChannelException;

/**
 * Why an upstream attempt failed, independent of the exception type that
 * carried it.
 */
public record FetchError(Kind kind, Throwable cause) {

    public enum Kind {
        CONNECT(true),
        TIMEOUT(true),
        TLS(true),
        PROTOCOL(true),
        TOO_LARGE(false),
        OTHER(true);

        private final boolean retryable;

        Kind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean retryable() {
            return retryable;
        }
    }

    public static FetchError from(Throwable failure) {
        Throwable cause = Futures.unwrap(failure);
        if (cause instanceof UpstreamException upstream) {
            return upstream.error();
        }
        return new FetchError(classify(cause), cause);
    }

    public String message() {
        return cause == null ? kind.name() : kind + ": " + cause.getMessage();
    }

    private static Kind classify(Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            return Kind.TOO_LARGE;
        }
        if (cause instanceof ConnectTimeoutException
                || cause instanceof TimeoutException
                || cause instanceof java.util.concurrent.TimeoutException) {
            return Kind.TIMEOUT;
        }
        if (cause instanceof ProxyConnectException || cause instanceof ConnectException) {
            return Kind.CONNECT;
        }
        if (cause instanceof SSLException
                || (cause instanceof DecoderException && cause.getCause() instanceof SSLException)) {
            return Kind.TLS;
        }
        if (cause instanceof DecoderException
                || cause instanceof PrematureChannelClosureException
                || cause instanceof ClosedChannelException) {
            return Kind.PROTOCOL;
        }
        return Kind.OTHER;
    }

}
