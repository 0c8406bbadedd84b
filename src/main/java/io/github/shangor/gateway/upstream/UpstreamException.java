package io.github.shangor.gateway.upstream;

import io.github.shangor.gateway.error.GatewayException;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * A single upstream attempt failed (connect, timeout, TLS, protocol).
 * {@link UpstreamFetcher#fetchWithRetry} retries these with a fresh credential.
 */
public class UpstreamException extends GatewayException {
    private final FetchError error;

    public UpstreamException(FetchError error) {
        super(HttpResponseStatus.BAD_GATEWAY, "Upstream fetch failed: " + error.message(), error.cause());
        this.error = error;
    }

    public FetchError error() {
        return error;
    }
}
