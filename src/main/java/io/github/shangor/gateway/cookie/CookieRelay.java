package io.github.shangor.gateway.cookie;

import io.github.shangor.gateway.session.VisitorSession;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Server-side cookie jar for the target site. Set-Cookie answers are reduced
 * to name=value (attributes are ignored) and merged into the session, last
 * write wins per name; later requests of the same session replay the whole
 * jar as one Cookie header. The visitor's own browser cookies are never
 * involved.
 */
public class CookieRelay {
    private static final Logger log = LoggerFactory.getLogger(CookieRelay.class);

    public void absorb(HttpHeaders responseHeaders, VisitorSession session) {
        absorb(responseHeaders.getAll(HttpHeaderNames.SET_COOKIE), session);
    }

    public void absorb(List<String> setCookieValues, VisitorSession session) {
        if (setCookieValues == null) {
            return;
        }
        for (String setCookie : setCookieValues) {
            Map.Entry<String, String> cookie = parse(setCookie);
            if (cookie == null) {
                log.warn("Ignoring unparsable Set-Cookie value");
                continue;
            }
            session.cookieJar().put(cookie.getKey(), cookie.getValue());
            if (log.isDebugEnabled())
                log.debug("Stored cookie {} for {}", cookie.getKey(), session);
        }
    }

    /**
     * The Cookie header for the next upstream request, or an empty string when
     * the jar is empty.
     */
    public String buildHeader(VisitorSession session) {
        return session.cookieJar().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; "));
    }

    public void clear(VisitorSession session) {
        session.cookieJar().clear();
    }

    static Map.Entry<String, String> parse(String setCookie) {
        if (setCookie == null) {
            return null;
        }
        int semi = setCookie.indexOf(';');
        String nameValue = semi >= 0 ? setCookie.substring(0, semi) : setCookie;
        int eq = nameValue.indexOf('=');
        String name = (eq >= 0 ? nameValue.substring(0, eq) : nameValue).trim();
        if (name.isEmpty()) {
            return null;
        }
        String value = eq >= 0 ? nameValue.substring(eq + 1).trim() : "";
        return Map.entry(name, value);
    }
}
