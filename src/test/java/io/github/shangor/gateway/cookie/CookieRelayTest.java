package io.github.shangor.gateway.cookie;

import io.github.shangor.gateway.session.VisitorSession;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CookieRelayTest {
    private final CookieRelay relay = new CookieRelay();

    private static VisitorSession session() {
        return new VisitorSession("s", "CRED0001", Instant.now());
    }

    @Test
    void testAbsorbIgnoresAttributes() {
        VisitorSession session = session();
        HttpHeaders headers = new DefaultHttpHeaders()
                .add(HttpHeaderNames.SET_COOKIE, "sid=abc123; Path=/; HttpOnly; Secure")
                .add(HttpHeaderNames.SET_COOKIE, "lang=en; Max-Age=3600");

        relay.absorb(headers, session);

        assertEquals("lang=en; sid=abc123", relay.buildHeader(session));
    }

    @Test
    void testNonConflictingAbsorptionCommutes() {
        VisitorSession ab = session();
        relay.absorb(List.of("a=1"), ab);
        relay.absorb(List.of("b=2"), ab);

        VisitorSession ba = session();
        relay.absorb(List.of("b=2"), ba);
        relay.absorb(List.of("a=1"), ba);

        assertEquals(relay.buildHeader(ab), relay.buildHeader(ba));
    }

    @Test
    void testLastWriteWins() {
        VisitorSession session = session();
        relay.absorb(List.of("token=first"), session);
        relay.absorb(List.of("token=second; Path=/"), session);
        assertEquals("token=second", relay.buildHeader(session));
    }

    @Test
    void testEmptyJarAndClear() {
        VisitorSession session = session();
        assertEquals("", relay.buildHeader(session));
        relay.absorb(List.of("a=1"), session);
        relay.clear(session);
        assertEquals("", relay.buildHeader(session));
    }

    @Test
    void testParse() {
        var entry = CookieRelay.parse("k=v=1=2; Path=/");
        assertEquals("k", entry.getKey());
        assertEquals("v=1=2", entry.getValue());
        assertEquals("", CookieRelay.parse("flag").getValue());
        assertNull(CookieRelay.parse("=value"));
        assertNull(CookieRelay.parse(null));
    }
}
