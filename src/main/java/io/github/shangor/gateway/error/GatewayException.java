package io.github.shangor.gateway.error;

import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base of every failure the gateway maps onto an HTTP answer.
 */
public class GatewayException extends RuntimeException {
    private final HttpResponseStatus status;

    public GatewayException(HttpResponseStatus status, String message) {
        super(message);
        this.status = status;
    }

    public GatewayException(HttpResponseStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpResponseStatus status() {
        return status;
    }
}
