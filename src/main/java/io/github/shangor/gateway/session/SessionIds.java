package io.github.shangor.gateway.session;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.UUID;

/**
 * Generates visitor session ids and upstream credential ids.
 */
public final class SessionIds {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private SessionIds() {
    }

    /**
     * Opaque visitor session id, 128 random bits as hex.
     */
    public static String newSessionId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0x0F];
            out[i * 2 + 1] = HEX[bytes[i] & 0x0F];
        }
        return new String(out);
    }

    /**
     * Upstream sticky-session id: 8 uppercase alphanumerics. The provider keys
     * its exit IP on this value, so a new one means a new exit IP.
     */
    public static String newCredentialId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
