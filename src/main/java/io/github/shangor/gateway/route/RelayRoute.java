package io.github.shangor.gateway.route;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.shangor.gateway.error.GatewayException;
import io.github.shangor.gateway.error.RelayProtocolException;
import io.github.shangor.gateway.handler.GatewayRequest;
import io.github.shangor.gateway.handler.GatewayResponses;
import io.github.shangor.gateway.intercept.RelayEnvelope;
import io.github.shangor.gateway.server.GatewayContext;
import io.github.shangor.gateway.session.VisitorSession;
import io.github.shangor.gateway.upstream.FetchOptions;
import io.github.shangor.gateway.upstream.FetchResult;
import io.github.shangor.gateway.util.Futures;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Server half of the interception relay. {@code POST /relay} takes a JSON
 * envelope from the service worker, {@code GET /relay?url=} is the plain form,
 * {@code GET /relay/test} reports the visit's exit IP.
 * <p>
 * The upstream body is returned untouched; its type and caching policy travel
 * in {@code X-Original-*} headers so the worker can rebuild a native response.
 */
class RelayRoute extends UpstreamRoute {
    private static final Logger log = LoggerFactory.getLogger(RelayRoute.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String IP_ECHO_URL = "https://api.ipify.org?format=json";

    RelayRoute(GatewayContext context) {
        super(context);
    }

    @Override
    public boolean matches(GatewayRequest request) {
        String path = request.path();
        return (path.equals("/relay") && (HttpMethod.GET.equals(request.method()) || HttpMethod.POST.equals(request.method())))
                || (path.equals("/relay/test") && HttpMethod.GET.equals(request.method()));
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(GatewayRequest request) {
        VisitorSession session = request.ensureSession();
        if (request.path().equals("/relay/test")) {
            return exitIp(session);
        }

        URI target;
        FetchOptions options;
        try {
            RelayEnvelope envelope = envelopeOf(request);
            target = context.guard().check(adjustUrl(request, envelope.url()));
            options = optionsFor(request, envelope, target);
        } catch (GatewayException e) {
            log.warn("Rejected relay request: {}", e.getMessage());
            return CompletableFuture.completedFuture(
                    GatewayResponses.withCors(GatewayResponses.jsonError(e.status(), errorName(e), e.getMessage())));
        }

        if (log.isDebugEnabled())
            log.debug("Relaying {} {} for credential {}", options.method(), target, session.credentialId());

        return context.fetcher().fetchWithRetry(target, session, options)
                .thenApply(RelayRoute::relayed)
                .exceptionally(failure -> {
                    Throwable cause = Futures.unwrap(failure);
                    log.warn("Relay of {} failed: {}", target, cause.getMessage());
                    return GatewayResponses.withCors(
                            GatewayResponses.jsonError(HttpResponseStatus.BAD_GATEWAY, "Relay failed", cause.getMessage()));
                });
    }

    /**
     * The envelope for a POST, or one built from the query for a GET. A
     * {@code url} query parameter stands in for a missing envelope URL.
     */
    static RelayEnvelope envelopeOf(GatewayRequest request) {
        RelayEnvelope envelope = HttpMethod.POST.equals(request.method())
                ? RelayEnvelope.parse(request.body())
                : new RelayEnvelope(null, "GET", null, null);
        if (envelope.url() == null || envelope.url().isBlank()) {
            String url = request.param("url")
                    .orElseThrow(() -> new RelayProtocolException("Relay request carries no url"));
            envelope = new RelayEnvelope(url, envelope.method(), envelope.headers(), envelope.body());
        }
        return envelope;
    }

    /**
     * Ad verification endpoints get the gateway origin swapped for the target's.
     */
    private String adjustUrl(GatewayRequest request, String url) {
        URI parsed;
        try {
            parsed = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return url;
        }
        if (parsed.getHost() != null && context.adRewriter().appliesTo(parsed)) {
            return context.adRewriter().rewriteUrl(url, request.gatewayOrigin(), context.config().getTargetBase());
        }
        return url;
    }

    private FetchOptions optionsFor(GatewayRequest request, RelayEnvelope envelope, URI target) {
        Map<String, String> headers = new LinkedHashMap<>(envelope.forwardedHeaders());
        if (context.adRewriter().appliesTo(target)) {
            String referer = headers.getOrDefault("referer", request.header(HttpHeaderNames.REFERER));
            String rewritten = context.adRewriter().rewriteReferer(referer, request.gatewayOrigin(), context.config().getTargetBase());
            if (rewritten != null) {
                headers.put("referer", rewritten);
            }
        }
        FetchOptions options = FetchOptions.defaults()
                .withMethod(HttpMethod.valueOf(envelope.methodOrGet()))
                .withHeaders(headers);
        if (envelope.hasBody()) {
            options = options.withBody(envelope.body().getBytes(StandardCharsets.UTF_8));
        }
        return options;
    }

    static FullHttpResponse relayed(FetchResult result) {
        String contentType = result.contentType();
        FullHttpResponse response = GatewayResponses.bytes(HttpResponseStatus.valueOf(result.status()), contentType, result.body());
        response.headers().set(GatewayResponses.ORIGINAL_CONTENT_TYPE, contentType);
        String cacheControl = result.headers().get(HttpHeaderNames.CACHE_CONTROL);
        if (cacheControl != null) {
            response.headers().set(GatewayResponses.ORIGINAL_CACHE_CONTROL, cacheControl);
        }
        response.headers().set(HttpHeaderNames.ACCESS_CONTROL_EXPOSE_HEADERS,
                GatewayResponses.ORIGINAL_CONTENT_TYPE + ", " + GatewayResponses.ORIGINAL_CACHE_CONTROL);
        return GatewayResponses.withCors(response);
    }

    private CompletableFuture<FullHttpResponse> exitIp(VisitorSession session) {
        return context.fetcher().fetchWithRetry(URI.create(IP_ECHO_URL), session, FetchOptions.defaults())
                .thenApply(result -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("success", true);
                    body.put("proxyIp", ipOf(result));
                    body.put("credentialId", session.credentialId());
                    return GatewayResponses.json(HttpResponseStatus.OK, body);
                })
                .exceptionally(failure -> {
                    Throwable cause = Futures.unwrap(failure);
                    log.warn("Exit IP check failed: {}", cause.getMessage());
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("success", false);
                    body.put("error", String.valueOf(cause.getMessage()));
                    body.put("credentialId", session.credentialId());
                    return GatewayResponses.json(HttpResponseStatus.BAD_GATEWAY, body);
                });
    }

    static String ipOf(FetchResult result) {
        try {
            JsonNode node = MAPPER.readTree(result.body());
            JsonNode ip = node == null ? null : node.get("ip");
            return ip == null ? null : ip.asText();
        } catch (IOException e) {
            log.warn("Unexpected IP echo answer: {}", e.getMessage());
            return null;
        }
    }

    private static String errorName(GatewayException e) {
        if (e instanceof RelayProtocolException) {
            return "Bad relay request";
        }
        return e.status().code() == 403 ? "Blocked target" : "Invalid URL";
    }
}
