package io.github.shangor.gateway.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory visitor session store keyed by the opaque session id.
 * Sessions idle for longer than the TTL are swept by {@link #expireIdle()}.
 */
public class SessionStore {
    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Map<String, VisitorSession> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private final Consumer<VisitorSession> onDestroy;

    public SessionStore(Duration ttl, Clock clock, Consumer<VisitorSession> onDestroy) {
        this.ttl = ttl;
        this.clock = clock;
        this.onDestroy = onDestroy;
    }

    public VisitorSession create() {
        VisitorSession session = new VisitorSession(SessionIds.newSessionId(), SessionIds.newCredentialId(), clock.instant());
        sessions.put(session.sessionId(), session);
        log.info("New visitor session, credential {}", session.credentialId());
        return session;
    }

    /**
     * Looks up a live session and marks it as used.
     */
    public Optional<VisitorSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        VisitorSession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        long now = clock.millis();
        if (isExpired(session, now)) {
            destroy(sessionId);
            return Optional.empty();
        }
        session.touch(now);
        return Optional.of(session);
    }

    public VisitorSession findOrCreate(String sessionId) {
        return find(sessionId).orElseGet(this::create);
    }

    public void destroy(String sessionId) {
        VisitorSession session = sessions.remove(sessionId);
        if (session != null) {
            session.deactivate();
            try {
                onDestroy.accept(session);
            } catch (RuntimeException e) {
                log.warn("Error while releasing session {}", session, e);
            }
            if (log.isDebugEnabled())
                log.debug("Destroyed {}", session);
        }
    }

    /**
     * Removes sessions idle for longer than the TTL.
     *
     * @return number of sessions removed
     */
    public int expireIdle() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Map.Entry<String, VisitorSession>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            VisitorSession session = it.next().getValue();
            if (isExpired(session, now)) {
                destroy(session.sessionId());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Expired {} idle visitor sessions, {} remaining", removed, sessions.size());
        }
        return removed;
    }

    public void destroyAll() {
        sessions.keySet().forEach(this::destroy);
    }

    public int size() {
        return sessions.size();
    }

    private boolean isExpired(VisitorSession session, long now) {
        return now - session.lastAccessMillis() > ttl.toMillis();
    }
}
