package io.github.shangor.gateway.intercept;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes the classifier's rule lists into the browser shims, and builds the
 * per-page configuration script, as JSON.
 */
public final class InterceptorRules {
    public static final String RULES_PLACEHOLDER = "\"__GATEWAY_RULES__\"";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private InterceptorRules() {
    }

    public static Map<String, Object> rules() {
        Map<String, Object> rules = new LinkedHashMap<>();
        rules.put("bypassPrefixes", TrafficClassifier.BYPASS_PREFIXES);
        rules.put("nonNetworkSchemes", TrafficClassifier.NON_NETWORK_SCHEMES);
        rules.put("adHosts", TrafficClassifier.AD_HOSTS);
        rules.put("adHostPaths", TrafficClassifier.AD_HOST_PATHS);
        rules.put("adPathMarkers", TrafficClassifier.AD_PATH_MARKERS);
        rules.put("verifyingHosts", AdReferenceRewriter.VERIFYING_HOSTS);
        return rules;
    }

    /**
     * Replaces the rules placeholder in a shim's source with the rule JSON.
     */
    public static String publish(String script) {
        return script.replace(RULES_PLACEHOLDER, toJson(rules()));
    }

    /**
     * Inline script that tells the shims which site they are standing in for.
     */
    public static String configScript(String targetUrl, String targetOrigin) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("targetUrl", targetUrl);
        config.put("targetOrigin", targetOrigin);
        return "<script>window.__GATEWAY__=" + toJson(config) + ";</script>";
    }

    static String toJson(Object value) {
        try {
            // keep "</script>" inside string values from closing the element
            return MAPPER.writeValueAsString(value).replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise interceptor rules", e);
        }
    }
}
