package io.github.shangor.gateway.upstream.tunnel;

import io.github.shangor.gateway.upstream.UpstreamCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one live tunnel per credential id. Concurrent acquires for the
 * same id share the same opening future.
 */
public class TunnelRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TunnelRegistry.class);

    @FunctionalInterface
    public interface TunnelOpener {
        CompletableFuture<UpstreamTunnel> open(UpstreamCredential credential);
    }

    private final TunnelOpener opener;
    private final Map<String, CompletableFuture<UpstreamTunnel>> tunnels = new ConcurrentHashMap<>();

    public TunnelRegistry(TunnelOpener opener) {
        this.opener = opener;
    }

    public CompletableFuture<UpstreamTunnel> acquire(UpstreamCredential credential) {
        String id = credential.credentialId();
        CompletableFuture<UpstreamTunnel> future = tunnels.computeIfAbsent(id, k -> opener.open(credential));
        // forget failed opens so the next acquire tries again
        future.whenComplete((tunnel, failure) -> {
            if (failure != null) {
                tunnels.remove(id, future);
            }
        });
        return future;
    }

    public void close(String credentialId) {
        CompletableFuture<UpstreamTunnel> future = tunnels.remove(credentialId);
        if (future == null) {
            return;
        }
        future.whenComplete((tunnel, failure) -> {
            if (tunnel != null) {
                tunnel.close();
            }
        });
    }

    public int size() {
        return tunnels.size();
    }

    public boolean contains(String credentialId) {
        return tunnels.containsKey(credentialId);
    }

    public void closeAll() {
        int count = tunnels.size();
        for (String id : tunnels.keySet()) {
            close(id);
        }
        if (count > 0) {
            log.info("Closed {} tunnels", count);
        }
    }

    @Override
    public void close() {
        closeAll();
    }
}
