package io.github.shangor.gateway.upstream.tunnel;

import io.github.shangor.gateway.upstream.UpstreamCredential;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.net.BindException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TunnelRegistryTest {
    private static EventLoopGroup group;

    @BeforeAll
    static void startGroup() {
        group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
    }

    @AfterAll
    static void stopGroup() {
        group.shutdownGracefully();
    }

    private static UpstreamCredential credential(String id) {
        return new UpstreamCredential(id, "proxy.example.net", 6200, "user-sessid-" + id, "secret");
    }

    @Test
    void testOneTunnelPerCredential() throws Exception {
        AtomicInteger opened = new AtomicInteger();
        TunnelRegistry registry = new TunnelRegistry(c -> {
            opened.incrementAndGet();
            return UpstreamTunnel.open(group, c, 1000);
        });
        try {
            UpstreamTunnel first = registry.acquire(credential("AAAA0001")).get(5, TimeUnit.SECONDS);
            UpstreamTunnel second = registry.acquire(credential("AAAA0001")).get(5, TimeUnit.SECONDS);

            assertSame(first, second);
            assertEquals(1, opened.get());
            assertTrue(first.isOpen());
            assertTrue(first.localEndpoint().getAddress().isLoopbackAddress());
            assertTrue(first.localEndpoint().getPort() > 0);
            assertEquals("AAAA0001", first.credentialId());

            UpstreamTunnel other = registry.acquire(credential("BBBB0002")).get(5, TimeUnit.SECONDS);
            assertNotSame(first, other);
            assertNotEquals(first.localEndpoint().getPort(), other.localEndpoint().getPort());
            assertEquals(2, registry.size());
        } finally {
            registry.closeAll();
        }
        assertEquals(0, registry.size());
    }

    @Test
    void testCloseForgetsTunnelAndReleasesPort() throws Exception {
        AtomicInteger opened = new AtomicInteger();
        TunnelRegistry registry = new TunnelRegistry(c -> {
            opened.incrementAndGet();
            return UpstreamTunnel.open(group, c, 1000);
        });
        UpstreamTunnel tunnel = registry.acquire(credential("CCCC0003")).get(5, TimeUnit.SECONDS);

        registry.close("CCCC0003");

        assertFalse(registry.contains("CCCC0003"));
        long deadline = System.currentTimeMillis() + 5000;
        while (tunnel.isOpen() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(tunnel.isOpen());

        UpstreamTunnel reopened = registry.acquire(credential("CCCC0003")).get(5, TimeUnit.SECONDS);
        assertNotSame(tunnel, reopened);
        assertEquals(2, opened.get());
        registry.close();
    }

    @Test
    void testFailedOpenIsNotCached() {
        AtomicInteger attempts = new AtomicInteger();
        TunnelRegistry registry = new TunnelRegistry(c -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new BindException("no port"));
        });

        var first = registry.acquire(credential("DDDD0004"));
        assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
        assertFalse(registry.contains("DDDD0004"));

        var second = registry.acquire(credential("DDDD0004"));
        assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
        assertEquals(2, attempts.get());
    }

    @Test
    void testClosingUnknownCredentialIsHarmless() {
        TunnelRegistry registry = new TunnelRegistry(c -> CompletableFuture.failedFuture(new IllegalStateException()));
        registry.close("NOPE0000");
        assertEquals(0, registry.size());
    }
}
