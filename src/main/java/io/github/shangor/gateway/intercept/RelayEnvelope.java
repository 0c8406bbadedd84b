package io.github.shangor.gateway.intercept;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.shangor.gateway.error.RelayProtocolException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Request the browser-side interceptor asks {@code /relay} to perform.
 * Header names are matched case-insensitively and only a fixed subset is
 * forwarded upstream.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelayEnvelope(String url, String method, Map<String, String> headers, String body) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    // RFC 9110 token characters
    private static final Pattern METHOD_TOKEN = Pattern.compile("[!#$%&'*+.^_`|~0-9A-Za-z-]+");

    static final List<String> FORWARDED_HEADERS = List.of("accept", "accept-language", "content-type", "referer", "origin", "user-agent");

    public static RelayEnvelope parse(byte[] json) {
        if (json == null || json.length == 0) {
            throw new RelayProtocolException("Relay body is empty");
        }
        try {
            RelayEnvelope envelope = MAPPER.readValue(json, RelayEnvelope.class);
            if (envelope == null) {
                throw new RelayProtocolException("Relay body is null");
            }
            envelope.methodOrGet();
            return envelope;
        } catch (JsonProcessingException e) {
            throw new RelayProtocolException("Malformed relay envelope: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new RelayProtocolException("Unreadable relay envelope: " + e.getMessage());
        }
    }

    /**
     * @throws RelayProtocolException when the method is not an HTTP token
     */
    public String methodOrGet() {
        if (method == null || method.isBlank()) {
            return "GET";
        }
        if (!METHOD_TOKEN.matcher(method).matches()) {
            throw new RelayProtocolException("Invalid relay method");
        }
        return method.toUpperCase(Locale.ROOT);
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }

    /**
     * The forwardable subset of {@link #headers()}, keyed by lower-case name.
     */
    public Map<String, String> forwardedHeaders() {
        Map<String, String> out = new LinkedHashMap<>();
        if (headers == null) {
            return out;
        }
        headers.forEach((name, value) -> {
            if (name == null || value == null) {
                return;
            }
            String lower = name.toLowerCase(Locale.ROOT);
            if (FORWARDED_HEADERS.contains(lower)) {
                out.put(lower, value);
            }
        });
        return out;
    }
}
