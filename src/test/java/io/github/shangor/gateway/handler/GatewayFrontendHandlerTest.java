package io.github.shangor.gateway.handler;

import io.github.shangor.gateway.config.GatewayConfig;
import io.github.shangor.gateway.error.SsrfBlockedException;
import io.github.shangor.gateway.route.Router;
import io.github.shangor.gateway.server.GatewayContext;
import io.github.shangor.gateway.session.SessionStore;
import io.github.shangor.gateway.upstream.FakeUpstreamClient;
import io.github.shangor.gateway.upstream.tunnel.TunnelRegistry;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class GatewayFrontendHandlerTest {
    private ScheduledExecutorService scheduler;
    private FakeUpstreamClient client;
    private GatewayContext context;
    private EmbeddedChannel channel;

    private void start(String targetUrl) {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        GatewayConfig config = new GatewayConfig();
        config.setTargetUrl(targetUrl);
        config.setRetryBackoffMillis(0);
        client = new FakeUpstreamClient();
        TunnelRegistry tunnels = new TunnelRegistry(c -> CompletableFuture.failedFuture(new IllegalStateException("no tunnels in tests")));
        context = GatewayContext.create(config, client, tunnels, scheduler);
        channel = new EmbeddedChannel(new GatewayFrontendHandler(context, Router.standard(context)));
    }

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.finishAndReleaseAll();
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    private FullHttpResponse send(HttpMethod method, String uri, String cookie, String body, String... headers) {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri,
                Unpooled.copiedBuffer(body == null ? "" : body, StandardCharsets.UTF_8));
        request.headers().set(HttpHeaderNames.HOST, "localhost:3000");
        if (cookie != null) {
            request.headers().set(HttpHeaderNames.COOKIE, cookie);
        }
        for (int i = 0; i + 1 < headers.length; i += 2) {
            request.headers().set(headers[i], headers[i + 1]);
        }
        channel.writeInbound(request);
        channel.runPendingTasks();
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "no response for " + method + " " + uri);
        return response;
    }

    private FullHttpResponse get(String uri, String cookie, String... headers) {
        return send(HttpMethod.GET, uri, cookie, null, headers);
    }

    private String proceed() {
        FullHttpResponse response = send(HttpMethod.POST, "/proceed", null, null);
        try {
            assertEquals(302, response.status().code());
            String setCookie = response.headers().get(HttpHeaderNames.SET_COOKIE);
            assertNotNull(setCookie);
            return setCookie.split(";")[0];
        } finally {
            response.release();
        }
    }

    private static String body(FullHttpResponse response) {
        try {
            return response.content().toString(StandardCharsets.UTF_8);
        } finally {
            response.release();
        }
    }

    @Test
    void testLandingThenProceedIssuesSessionCookie() {
        start("https://example.com/");

        FullHttpResponse landing = get("/", null);
        assertEquals(200, landing.status().code());
        assertTrue(landing.headers().get(HttpHeaderNames.CONTENT_TYPE).startsWith("text/html"));
        landing.release();

        FullHttpResponse proceeded = send(HttpMethod.POST, "/proceed", null, null);
        assertEquals("/browse", proceeded.headers().get(HttpHeaderNames.LOCATION));
        String setCookie = proceeded.headers().get(HttpHeaderNames.SET_COOKIE);
        assertTrue(setCookie.startsWith(GatewayRequest.SESSION_COOKIE + "="));
        assertTrue(setCookie.contains("HttpOnly"));
        assertTrue(setCookie.contains("SameSite=Lax"));
        assertTrue(setCookie.contains("Max-Age=7200"));
        assertEquals(1, context.sessions().size());
        proceeded.release();
    }

    @Test
    void testLandingRedirectsWhenVisitIsActive() {
        start("https://example.com/");
        String cookie = proceed();

        FullHttpResponse response = get("/", cookie);

        assertEquals(302, response.status().code());
        assertEquals("/browse", response.headers().get(HttpHeaderNames.LOCATION));
        response.release();
    }

    @Test
    void testResetClearsVisit() {
        start("https://example.com/");
        String cookie = proceed();

        FullHttpResponse response = get("/reset", cookie);

        assertEquals("/", response.headers().get(HttpHeaderNames.LOCATION));
        assertTrue(response.headers().get(HttpHeaderNames.SET_COOKIE).contains("Max-Age=0"));
        assertEquals(0, context.sessions().size());
        response.release();

        FullHttpResponse browse = get("/browse/", cookie);
        assertEquals(302, browse.status().code());
        assertEquals("/", browse.headers().get(HttpHeaderNames.LOCATION));
        browse.release();
    }

    @Test
    void testBrowseRewritesAndInjects() {
        start("https://example.com/");
        String cookie = proceed();
        client.thenAnswer(200, new DefaultHttpHeaders()
                        .set(HttpHeaderNames.CONTENT_TYPE, "text/html; charset=utf-8")
                        .add(HttpHeaderNames.SET_COOKIE, "pref=dark; Path=/"),
                "<html><head></head><body><a href=\"/about\">About</a></body></html>");

        String html = body(get("/browse/news?id=7", cookie, "Accept", "text/html"));

        assertEquals("https://example.com/news?id=7", client.lastRequest().url().toString());
        assertEquals("https://example.com/", client.lastRequest().headers().get(HttpHeaderNames.REFERER));
        assertTrue(html.contains("href=\"/browse/about\""), html);
        assertTrue(html.contains("/gateway/intercept.js"));
        assertTrue(html.contains("window.__GATEWAY__"));

        client.thenHtml("<html><body>second</body></html>");
        get("/browse/next", cookie).release();
        assertTrue(client.lastRequest().headers().get(HttpHeaderNames.COOKIE).contains("pref=dark"));
    }

    @Test
    void testStylesheetAnsweredWithHtmlBecomesEmptyCss() {
        start("https://example.com/");
        String cookie = proceed();
        client.thenHtml("<!DOCTYPE html><html><body>Not Found</body></html>");

        FullHttpResponse response = get("/browse/css/site.css", cookie, "Accept", "text/css,*/*;q=0.1");

        assertEquals("text/css", response.headers().get(HttpHeaderNames.CONTENT_TYPE).split(";")[0]);
        assertEquals(0, response.content().readableBytes());
        response.release();
    }

    @Test
    void testInternalTargetRefusedOnBrowse() {
        start("http://127.0.0.1/");
        String cookie = proceed();

        FullHttpResponse response = get("/browse/", cookie, "Accept", "text/html");

        assertEquals(403, response.status().code());
        assertEquals(0, client.calls());
        response.release();
    }

    @Test
    void testInternalTargetRefusedOnExternal() {
        start("https://example.com/");
        String cookie = proceed();

        FullHttpResponse response = get("/external/http%3A%2F%2F10.0.0.1%2F", cookie);

        assertEquals(403, response.status().code());
        assertEquals(0, client.calls());
        response.release();
    }

    @Test
    void testInternalTargetRefusedOnNavigate() {
        start("https://example.com/");

        FullHttpResponse response = get("/navigate?url=http://192.168.1.1/", null);

        assertEquals(403, response.status().code());
        assertEquals(0, client.calls());
        response.release();
    }

    @Test
    void testInternalTargetRefusedOnRelay() {
        start("https://example.com/");

        FullHttpResponse response = send(HttpMethod.POST, "/relay", null, "{\"url\":\"http://127.0.0.1/\"}",
                "Content-Type", "application/json");

        assertEquals(403, response.status().code());
        assertEquals("*", response.headers().get(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN));
        assertTrue(body(response).contains("Blocked target"));
        assertEquals(0, client.calls());
    }

    @Test
    void testRelayCarriesOriginalHeaders() {
        start("https://example.com/");
        client.thenAnswer(200, new DefaultHttpHeaders()
                        .set(HttpHeaderNames.CONTENT_TYPE, "application/javascript")
                        .set(HttpHeaderNames.CACHE_CONTROL, "max-age=60"),
                "console.log(1);");

        FullHttpResponse response = send(HttpMethod.POST, "/relay", null,
                "{\"url\":\"https://cdn.example.net/app.js\",\"method\":\"GET\",\"headers\":{\"Accept\":\"*/*\",\"Cookie\":\"x=1\"}}");

        assertEquals(200, response.status().code());
        assertEquals("application/javascript", response.headers().get(GatewayResponses.ORIGINAL_CONTENT_TYPE));
        assertEquals("max-age=60", response.headers().get(GatewayResponses.ORIGINAL_CACHE_CONTROL));
        assertTrue(response.headers().get(HttpHeaderNames.ACCESS_CONTROL_EXPOSE_HEADERS).contains(GatewayResponses.ORIGINAL_CONTENT_TYPE));
        assertEquals("console.log(1);", body(response));
        assertEquals("*/*", client.lastRequest().headers().get(HttpHeaderNames.ACCEPT));
        assertNull(client.lastRequest().headers().get(HttpHeaderNames.COOKIE));
    }

    @Test
    void testRelayDoesNotFollowRedirectToInternalHost() {
        start("https://example.com/");
        client.thenRedirect(302, "http://10.0.0.1/admin");

        FullHttpResponse response = send(HttpMethod.POST, "/relay", null, "{\"url\":\"https://public.example.org/x\"}");

        assertEquals(302, response.status().code());
        assertEquals(1, client.calls());
        assertTrue(client.exchanges().stream().noneMatch(e -> "10.0.0.1".equals(e.request().url().getHost())));
        response.release();
    }

    @Test
    void testRelayRejectsMethodThatIsNotAToken() {
        start("https://example.com/");

        FullHttpResponse response = send(HttpMethod.POST, "/relay", null,
                "{\"url\":\"https://public.example.org/x\",\"method\":\"GE T\"}");

        assertEquals(400, response.status().code());
        assertEquals("*", response.headers().get(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN));
        assertTrue(response.headers().get(HttpHeaderNames.CONTENT_TYPE).startsWith("application/json"));
        assertTrue(body(response).contains("Bad relay request"));
        assertEquals(0, client.calls());
    }

    @Test
    void testBrowseRedirectChainKeepsTargetCookiesOnly() {
        start("https://example.com/");
        String cookie = proceed();
        client.thenAnswer(200, new DefaultHttpHeaders()
                        .set(HttpHeaderNames.CONTENT_TYPE, "text/html")
                        .add(HttpHeaderNames.SET_COOKIE, "sid=SECRET; Path=/"),
                "<html><body>first</body></html>");
        get("/browse/", cookie).release();

        client.thenAnswer(302, new DefaultHttpHeaders()
                        .set(HttpHeaderNames.LOCATION, "https://tracker.other.net/pixel")
                        .add(HttpHeaderNames.SET_COOKIE, "step=1; Path=/"), "")
                .thenAnswer(302, new DefaultHttpHeaders()
                        .set(HttpHeaderNames.LOCATION, "https://example.com/home")
                        .add(HttpHeaderNames.SET_COOKIE, "track=1; Path=/"), "")
                .thenHtml("<html><body>home</body></html>");
        get("/browse/start", cookie).release();

        assertEquals(4, client.calls());
        assertTrue(client.exchanges().get(1).request().headers().get(HttpHeaderNames.COOKIE).contains("sid=SECRET"));
        assertEquals("tracker.other.net", client.exchanges().get(2).request().url().getHost());
        assertFalse(client.exchanges().get(2).request().headers().contains(HttpHeaderNames.COOKIE));

        client.thenHtml("<html><body>again</body></html>");
        get("/browse/again", cookie).release();
        String replayed = client.lastRequest().headers().get(HttpHeaderNames.COOKIE);
        assertTrue(replayed.contains("step=1"), replayed);
        assertFalse(replayed.contains("track=1"), replayed);
    }

    @Test
    void testNavigateCollapsesRedirects() {
        start("https://example.com/");
        client.thenRedirect(302, "https://shop.example.org/landing")
                .thenHtml("<html><body><a href=\"/cart\">Cart</a></body></html>");

        FullHttpResponse response = get("/navigate?url=https%3A%2F%2Fads.example.net%2Fclick", null, "Accept", "text/html");

        assertEquals(200, response.status().code());
        assertEquals(2, client.calls());
        assertNotNull(response.headers().get(HttpHeaderNames.SET_COOKIE));
        String html = body(response);
        assertTrue(html.contains("/gateway/navigate.js"));
        assertTrue(html.contains("/navigate?url=https%3A%2F%2Fshop.example.org%2Fcart"), html);
    }

    @Test
    void testPreflightAndStaticAssets() {
        start("https://example.com/");

        FullHttpResponse preflight = send(HttpMethod.OPTIONS, "/relay", null, null);
        assertEquals(204, preflight.status().code());
        assertEquals("86400", preflight.headers().get(HttpHeaderNames.ACCESS_CONTROL_MAX_AGE));
        preflight.release();

        FullHttpResponse worker = get("/sw.js", null);
        assertEquals(200, worker.status().code());
        assertEquals("/", worker.headers().get("Service-Worker-Allowed"));
        assertFalse(body(worker).contains("__GATEWAY_RULES__"));

        FullHttpResponse missing = get("/nope", null);
        assertEquals(404, missing.status().code());
        missing.release();
    }

    @Test
    void testFailureResponseStatuses() {
        SessionStore sessions = new SessionStore(Duration.ofMinutes(1), Clock.systemUTC(), s -> { });
        GatewayRequest request = new GatewayRequest(HttpMethod.GET, "/browse/", new DefaultHttpHeaders(), new byte[0], sessions);

        assertEquals(403, GatewayFrontendHandler.failureResponse(request, new SsrfBlockedException("10.0.0.1")).status().code());
        assertEquals(502, GatewayFrontendHandler.failureResponse(request, new ConnectException("refused")).status().code());
        assertEquals(504, GatewayFrontendHandler.failureResponse(request, new TimeoutException()).status().code());
        assertEquals(500, GatewayFrontendHandler.failureResponse(request, new IllegalStateException("boom")).status().code());
    }
}
