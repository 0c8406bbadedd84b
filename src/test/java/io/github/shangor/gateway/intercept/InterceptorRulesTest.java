package io.github.shangor.gateway.intercept;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InterceptorRulesTest {

    @Test
    void testPublishReplacesPlaceholder() throws Exception {
        String script = "const RULES = \"__GATEWAY_RULES__\";";

        String published = InterceptorRules.publish(script);

        assertFalse(published.contains("__GATEWAY_RULES__"));
        String json = published.substring("const RULES = ".length(), published.length() - 1);
        JsonNode rules = new ObjectMapper().readTree(json);
        assertEquals("/relay", rules.get("bypassPrefixes").get(0).asText());
        assertEquals(TrafficClassifier.AD_HOSTS.size(), rules.get("adHosts").size());
        assertEquals("google.com", rules.get("adHostPaths").get(0).get(0).asText());
        assertTrue(rules.has("verifyingHosts"));
    }

    @Test
    void testConfigScriptCannotCloseItsElement() {
        String script = InterceptorRules.configScript("https://example.com/</script><b>", "https://example.com");

        assertTrue(script.startsWith("<script>window.__GATEWAY__={\"targetUrl\":"));
        assertTrue(script.endsWith(";</script>"));
        assertEquals(1, script.split("</script>", -1).length - 1);
        assertTrue(script.contains("<\\/script><b>"));
    }
}
