package io.github.shangor.gateway.upstream;

import io.github.shangor.gateway.error.GatewayException;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.net.URI;

public class UpstreamExhaustedException extends GatewayException {
    private final URI url;
    private final int attempts;
    private final FetchError lastError;

    public UpstreamExhaustedException(URI url, int attempts, FetchError lastError) {
        super(HttpResponseStatus.BAD_GATEWAY,
                "All " + attempts + " upstream attempts failed for " + url + ": " + lastError.message(),
                lastError.cause());
        this.url = url;
        this.attempts = attempts;
        this.lastError = lastError;
    }

    public URI url() {
        return url;
    }

    public int attempts() {
        return attempts;
    }

    public FetchError lastError() {
        return lastError;
    }
}
