package io.github.shangor.gateway.error;

import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Target host is loopback or inside a private range.
 */
public class SsrfBlockedException extends GatewayException {
    private final String host;

    public SsrfBlockedException(String host) {
        super(HttpResponseStatus.FORBIDDEN, "Cannot proxy to internal address: " + host);
        this.host = host;
    }

    public String host() {
        return host;
    }
}
