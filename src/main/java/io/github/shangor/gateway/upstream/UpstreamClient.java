package io.github.shangor.gateway.upstream;

import java.util.concurrent.CompletableFuture;

/**
 * Executes exactly one HTTP exchange through the upstream identified by the
 * credential. Redirects are not followed here. A failed future carries the
 * transport failure; any HTTP status, 5xx included, completes normally.
 */
public interface UpstreamClient extends AutoCloseable {

    CompletableFuture<FetchResult> execute(FetchRequest request, UpstreamCredential credential);

    @Override
    default void close() {
    }
}
