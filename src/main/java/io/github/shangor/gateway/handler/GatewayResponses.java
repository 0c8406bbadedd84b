package io.github.shangor.gateway.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.jsoup.nodes.Entities;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for the responses the gateway writes itself.
 */
public final class GatewayResponses {
    public static final String ORIGINAL_CONTENT_TYPE = "X-Original-Content-Type";
    public static final String ORIGINAL_CACHE_CONTROL = "X-Original-Cache-Control";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, String> RESOURCES = new ConcurrentHashMap<>();

    private GatewayResponses() {
    }

    public static FullHttpResponse bytes(HttpResponseStatus status, String contentType, byte[] body) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(body));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
        return response;
    }

    public static FullHttpResponse html(HttpResponseStatus status, String html) {
        return bytes(status, "text/html; charset=utf-8", html.getBytes(StandardCharsets.UTF_8));
    }

    public static FullHttpResponse text(HttpResponseStatus status, String contentType, String text) {
        return bytes(status, contentType, text.getBytes(StandardCharsets.UTF_8));
    }

    public static FullHttpResponse json(HttpResponseStatus status, Object value) {
        try {
            return bytes(status, "application/json; charset=utf-8", MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise response body", e);
        }
    }

    /**
     * Structured failure body for API callers: {@code {"error": ..., "message": ...}}.
     */
    public static FullHttpResponse jsonError(HttpResponseStatus status, String error, String message) {
        return json(status, Map.of("error", error, "message", message == null ? "" : message));
    }

    /**
     * A typed body with no content, served in place of a failed sub-resource.
     */
    public static FullHttpResponse empty(HttpResponseStatus status, String contentType) {
        return bytes(status, contentType, new byte[0]);
    }

    public static FullHttpResponse redirect(String location) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.FOUND);
        response.headers().set(HttpHeaderNames.LOCATION, location);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
        return response;
    }

    public static FullHttpResponse errorPage(HttpResponseStatus status, String title, String message) {
        String page = resource("templates/error.html")
                .replace("{{title}}", Entities.escape(title))
                .replace("{{message}}", Entities.escape(message == null ? "" : message));
        return html(status, page);
    }

    public static FullHttpResponse notFound() {
        return errorPage(HttpResponseStatus.NOT_FOUND, "Not Found", "The page you requested was not found.");
    }

    public static FullHttpResponse withCors(FullHttpResponse response) {
        response.headers()
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS")
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type, Authorization, X-Requested-With");
        return response;
    }

    public static FullHttpResponse preflight() {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.NO_CONTENT);
        withCors(response);
        response.headers().set(HttpHeaderNames.ACCESS_CONTROL_MAX_AGE, "86400");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, HttpHeaderValues.ZERO);
        return response;
    }

    /**
     * Loads a UTF-8 classpath resource once and keeps it.
     */
    public static String resource(String path) {
        return RESOURCES.computeIfAbsent(path, GatewayResponses::load);
    }

    private static String load(String path) {
        try (InputStream in = GatewayResponses.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read classpath resource " + path, e);
        }
    }
}
