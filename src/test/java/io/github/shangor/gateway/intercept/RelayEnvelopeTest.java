package io.github.shangor.gateway.intercept;

import io.github.shangor.gateway.error.RelayProtocolException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayEnvelopeTest {

    private static RelayEnvelope parse(String json) {
        return RelayEnvelope.parse(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testParse() {
        RelayEnvelope envelope = parse("""
                {"url":"https://api.example.net/v1/items","method":"post",
                 "headers":{"Content-Type":"application/json","Accept":"*/*","Cookie":"sid=1","X-Custom":"y"},
                 "body":"{\\"a\\":1}","credentials":"include"}
                """);

        assertEquals("https://api.example.net/v1/items", envelope.url());
        assertEquals("POST", envelope.methodOrGet());
        assertTrue(envelope.hasBody());
        assertEquals("{\"a\":1}", envelope.body());
        assertEquals(Map.of("content-type", "application/json", "accept", "*/*"), envelope.forwardedHeaders());
    }

    @Test
    void testDefaults() {
        RelayEnvelope envelope = parse("{\"url\":\"https://a.example.org/\"}");

        assertEquals("GET", envelope.methodOrGet());
        assertFalse(envelope.hasBody());
        assertTrue(envelope.forwardedHeaders().isEmpty());
    }

    @Test
    void testRejectsBadBodies() {
        assertThrows(RelayProtocolException.class, () -> RelayEnvelope.parse(new byte[0]));
        assertThrows(RelayProtocolException.class, () -> RelayEnvelope.parse(null));
        assertThrows(RelayProtocolException.class, () -> parse("{\"url\":"));
        assertThrows(RelayProtocolException.class, () -> parse("null"));
    }

    @Test
    void testRejectsMethodThatIsNotAToken() {
        assertThrows(RelayProtocolException.class, () -> parse("{\"url\":\"https://a.example.org/\",\"method\":\"GE T\"}"));
        assertThrows(RelayProtocolException.class, () -> parse("{\"url\":\"https://a.example.org/\",\"method\":\"GET\\r\\nX: y\"}"));
        assertThrows(RelayProtocolException.class,
                () -> new RelayEnvelope("https://a.example.org/", "PO(ST", null, null).methodOrGet());

        assertEquals("PATCH", parse("{\"url\":\"https://a.example.org/\",\"method\":\"patch\"}").methodOrGet());
    }
}
