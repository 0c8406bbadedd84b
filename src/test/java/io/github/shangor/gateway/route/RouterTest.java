package io.github.shangor.gateway.route;

import io.github.shangor.gateway.config.GatewayConfig;
import io.github.shangor.gateway.error.InvalidUrlException;
import io.github.shangor.gateway.error.RelayProtocolException;
import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.intercept.RelayEnvelope;
import io.github.shangor.gateway.server.GatewayContext;
import io.github.shangor.gateway.session.SessionStore;
import io.github.shangor.gateway.upstream.FakeUpstreamClient;
import io.github.shangor.gateway.upstream.tunnel.TunnelRegistry;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class RouterTest {
    private final SessionStore sessions = new SessionStore(Duration.ofMinutes(5), Clock.systemUTC(), s -> { });

    private GatewayRequest request(HttpMethod method, String uri, String body) {
        FullHttpRequest raw = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri,
                Unpooled.copiedBuffer(body == null ? "" : body, StandardCharsets.UTF_8));
        try {
            return GatewayRequest.from(raw, sessions);
        } finally {
            raw.release();
        }
    }

    @Test
    void testRegistrationOrder() {
        GatewayContext context = GatewayContext.create(new GatewayConfig(), new FakeUpstreamClient(),
                new TunnelRegistry(c -> CompletableFuture.failedFuture(new IllegalStateException())), null);
        Router router = Router.standard(context);

        assertInstanceOf(PreflightRoute.class, router.routes().get(0));
        assertInstanceOf(BrowseRoute.class, router.routes().get(router.routes().size() - 1));
    }

    @Test
    void testPreflightMatching() {
        PreflightRoute route = new PreflightRoute();
        assertTrue(route.matches(request(HttpMethod.OPTIONS, "/browse/a.js", null)));
        assertTrue(route.matches(request(HttpMethod.OPTIONS, "/external/x", null)));
        assertTrue(route.matches(request(HttpMethod.OPTIONS, "/relay", null)));
        assertFalse(route.matches(request(HttpMethod.OPTIONS, "/navigate", null)));
        assertFalse(route.matches(request(HttpMethod.GET, "/relay", null)));
    }

    @Test
    void testRouteBoundaries() {
        assertTrue(Route.isUnder("/browse", "/browse"));
        assertTrue(Route.isUnder("/browse/a", "/browse"));
        assertFalse(Route.isUnder("/browser", "/browse"));
    }

    @Test
    void testExternalUrl() {
        assertEquals("https://cdn.example.net/a.js?v=1",
                ExternalRoute.externalUrl(request(HttpMethod.GET, "/external/https%3A%2F%2Fcdn.example.net%2Fa.js%3Fv%3D1", null)));
        assertEquals("https://cdn.example.net/a.js?v=2",
                ExternalRoute.externalUrl(request(HttpMethod.GET, "/external/https%3A%2F%2Fcdn.example.net%2Fa.js?v=2", null)));
        assertThrows(InvalidUrlException.class,
                () -> ExternalRoute.externalUrl(request(HttpMethod.GET, "/external/https%3A%2F%2Fbad%ZZ", null)));
    }

    @Test
    void testNavigationUrl() {
        assertEquals("https://shop.example.org/p?id=1",
                NavigateRoute.navigationUrl(request(HttpMethod.GET, "/navigate?url=https%3A%2F%2Fshop.example.org%2Fp%3Fid%3D1", null)));
        // double encoded by a page that encoded an already encoded value
        assertEquals("https://shop.example.org/",
                NavigateRoute.navigationUrl(request(HttpMethod.GET, "/navigate?url=https%253A%252F%252Fshop.example.org%252F", null)));
        assertEquals("https://shop.example.org/100%",
                NavigateRoute.navigationUrl(request(HttpMethod.GET, "/navigate?url=https%3A%2F%2Fshop.example.org%2F100%25", null)));
        assertThrows(InvalidUrlException.class, () -> NavigateRoute.navigationUrl(request(HttpMethod.GET, "/navigate", null)));
    }

    @Test
    void testNavigationUrlKeepsEscapesInsideTheTarget() {
        assertEquals("https://shop.example.org/s?q=a%26b",
                NavigateRoute.navigationUrl(request(HttpMethod.GET, "/navigate?url=https%3A%2F%2Fshop.example.org%2Fs%3Fq%3Da%2526b", null)));
        assertEquals("https://shop.example.org/caf%C3%A9",
                NavigateRoute.navigationUrl(request(HttpMethod.GET, "/navigate?url=https://shop.example.org/caf%25C3%25A9", null)));
    }

    @Test
    void testRelayEnvelopeFromQueryOrBody() {
        RelayEnvelope fromQuery = RelayRoute.envelopeOf(request(HttpMethod.GET, "/relay?url=https%3A%2F%2Fa.example.org%2F", null));
        assertEquals("https://a.example.org/", fromQuery.url());
        assertEquals("GET", fromQuery.methodOrGet());

        RelayEnvelope fromBody = RelayRoute.envelopeOf(request(HttpMethod.POST, "/relay",
                "{\"url\":\"https://b.example.org/api\",\"method\":\"PUT\",\"body\":\"x\"}"));
        assertEquals("https://b.example.org/api", fromBody.url());
        assertEquals("PUT", fromBody.methodOrGet());

        RelayEnvelope filled = RelayRoute.envelopeOf(request(HttpMethod.POST, "/relay?url=https%3A%2F%2Fc.example.org%2F",
                "{\"method\":\"POST\"}"));
        assertEquals("https://c.example.org/", filled.url());

        assertThrows(RelayProtocolException.class, () -> RelayRoute.envelopeOf(request(HttpMethod.GET, "/relay", null)));
    }
}
