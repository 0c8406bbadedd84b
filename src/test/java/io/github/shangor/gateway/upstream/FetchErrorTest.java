package io.github.shangor.gateway.upstream;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.proxy.ProxyConnectException;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class FetchErrorTest {

    @Test
    void testClassifiesTransportFailures() {
        assertEquals(FetchError.Kind.CONNECT, FetchError.from(new ConnectException("refused")).kind());
        assertEquals(FetchError.Kind.CONNECT, FetchError.from(new ProxyConnectException("socks5 auth failed")).kind());
        assertEquals(FetchError.Kind.TIMEOUT, FetchError.from(new ConnectTimeoutException("slow")).kind());
        assertEquals(FetchError.Kind.TIMEOUT, FetchError.from(new TimeoutException()).kind());
        assertEquals(FetchError.Kind.TLS, FetchError.from(new SSLHandshakeException("bad cert")).kind());
        assertEquals(FetchError.Kind.TLS, FetchError.from(new DecoderException(new SSLHandshakeException("bad cert"))).kind());
        assertEquals(FetchError.Kind.PROTOCOL, FetchError.from(new DecoderException("garbage")).kind());
        assertEquals(FetchError.Kind.TOO_LARGE, FetchError.from(new TooLongFrameException("huge")).kind());
        assertEquals(FetchError.Kind.OTHER, FetchError.from(new IOException("reset")).kind());
    }

    @Test
    void testUnwrapsCompletionAndKeepsUpstreamError() {
        FetchError original = new FetchError(FetchError.Kind.TLS, new SSLHandshakeException("x"));
        FetchError fromWrapped = FetchError.from(new CompletionException(new UpstreamException(original)));
        assertSame(original, fromWrapped);

        FetchError timeout = FetchError.from(new CompletionException(new TimeoutException()));
        assertEquals(FetchError.Kind.TIMEOUT, timeout.kind());
    }

    @Test
    void testOnlyTooLargeIsFinal() {
        for (FetchError.Kind kind : FetchError.Kind.values()) {
            assertEquals(kind != FetchError.Kind.TOO_LARGE, kind.retryable(), kind.name());
        }
    }
}
