package io.github.shangor.gateway.handler;

import io.github.shangor.gateway.session.SessionStore;
import io.github.shangor.gateway.session.VisitorSession;
import io.netty.buffer.ByteBufUtil;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.cookie.Cookie;
import io.netty.handler.codec.http.cookie.ServerCookieDecoder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * One browser request, detached from Netty's reference-counted message so it
 * can outlive the channel read. Carries the visitor session and records
 * whether the session cookie has to be (re)issued or cleared.
 */
public final class GatewayRequest {
    public static final String SESSION_COOKIE = "gw_session";

    private final HttpMethod method;
    private final String uri;
    private final QueryStringDecoder query;
    private final HttpHeaders headers;
    private final byte[] body;
    private final SessionStore sessions;

    private VisitorSession session;
    private boolean issueCookie;
    private boolean clearCookie;

    GatewayRequest(HttpMethod method, String uri, HttpHeaders headers, byte[] body, SessionStore sessions) {
        this.method = method;
        this.uri = uri;
        this.query = new QueryStringDecoder(uri);
        this.headers = headers;
        this.body = body;
        this.sessions = sessions;
        this.session = sessions.find(sessionIdFrom(headers)).orElse(null);
    }

    public static GatewayRequest from(FullHttpRequest request, SessionStore sessions) {
        return new GatewayRequest(request.method(), request.uri(), request.headers().copy(),
                ByteBufUtil.getBytes(request.content()), sessions);
    }

    static String sessionIdFrom(HttpHeaders headers) {
        String header = headers.get(HttpHeaderNames.COOKIE);
        if (header == null) {
            return null;
        }
        for (Cookie cookie : ServerCookieDecoder.LAX.decode(header)) {
            if (SESSION_COOKIE.equals(cookie.name())) {
                return cookie.value();
            }
        }
        return null;
    }

    public HttpMethod method() {
        return method;
    }

    public String uri() {
        return uri;
    }

    /**
     * Decoded path, without the query string.
     */
    public String path() {
        return query.path();
    }

    /**
     * The path exactly as sent, still percent-encoded.
     */
    public String rawPath() {
        return query.rawPath();
    }

    public String rawQuery() {
        return query.rawQuery();
    }

    public Optional<String> param(String name) {
        List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public HttpHeaders headers() {
        return headers;
    }

    public String header(CharSequence name) {
        return headers.get(name);
    }

    public byte[] body() {
        return body;
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    /**
     * scheme://host[:port] the browser used to reach the gateway.
     */
    public String gatewayOrigin() {
        String proto = headers.get("X-Forwarded-Proto");
        String scheme = proto == null || proto.isBlank() ? "http" : proto.split(",")[0].trim();
        String host = headers.get(HttpHeaderNames.HOST, "localhost");
        return scheme + "://" + host;
    }

    public URI gatewayOriginUri() {
        return URI.create(gatewayOrigin() + "/");
    }

    public Optional<VisitorSession> session() {
        return Optional.ofNullable(session).filter(VisitorSession::isActive);
    }

    /**
     * The active session, created on the spot when the visitor has none.
     */
    public VisitorSession ensureSession() {
        if (session == null || !session.isActive()) {
            session = sessions.create();
            issueCookie = true;
            clearCookie = false;
        }
        return session;
    }

    /**
     * Replaces any current session with a fresh one.
     */
    public VisitorSession startSession() {
        if (session != null) {
            sessions.destroy(session.sessionId());
        }
        session = null;
        return ensureSession();
    }

    public void resetSession() {
        if (session != null) {
            sessions.destroy(session.sessionId());
            session = null;
        }
        issueCookie = false;
        clearCookie = true;
    }

    boolean issueCookie() {
        return issueCookie;
    }

    boolean clearCookie() {
        return clearCookie;
    }

    VisitorSession currentSession() {
        return session;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
