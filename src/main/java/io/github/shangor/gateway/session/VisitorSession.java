package io.github.shangor.gateway.session;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One browsing visit. The upstream credential id is the only field that
 * changes identity during the visit and it only moves forward, through
 * {@link #rotateCredential(String, String)}.
 */
public final class VisitorSession {
    private final String sessionId;
    private final Instant createdAt;
    private final AtomicReference<String> credentialId;
    // sorted so the serialised Cookie header does not depend on absorption order
    private final Map<String, String> cookieJar = new ConcurrentSkipListMap<>();
    private volatile boolean active;
    private volatile long lastAccessMillis;

    public VisitorSession(String sessionId, String credentialId, Instant createdAt) {
        this.sessionId = sessionId;
        this.credentialId = new AtomicReference<>(credentialId);
        this.createdAt = createdAt;
        this.lastAccessMillis = createdAt.toEpochMilli();
        this.active = true;
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * The current credential id. Read it again after every fetch; rotation
     * replaces it in place.
     */
    public String credentialId() {
        return credentialId.get();
    }

    /**
     * Replaces {@code expected} with {@code next}. Returns false when another
     * request already rotated away from {@code expected}.
     */
    public boolean rotateCredential(String expected, String next) {
        return credentialId.compareAndSet(expected, next);
    }

    public Map<String, String> cookieJar() {
        return cookieJar;
    }

    public boolean isActive() {
        return active;
    }

    public void deactivate() {
        this.active = false;
    }

    public long lastAccessMillis() {
        return lastAccessMillis;
    }

    public void touch(long nowMillis) {
        this.lastAccessMillis = nowMillis;
    }

    @Override
    public String toString() {
        return "VisitorSession{" + sessionId.substring(0, Math.min(8, sessionId.length())) + "…, credential="
                + credentialId.get() + ", active=" + active + "}";
    }
}
