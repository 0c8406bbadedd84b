package io.github.shangor.gateway.error;

import io.netty.handler.codec.http.HttpResponseStatus;

public class RelayProtocolException extends GatewayException {
    public RelayProtocolException(String message) {
        super(HttpResponseStatus.BAD_REQUEST, message);
    }

    public RelayProtocolException(String message, Throwable cause) {
        super(HttpResponseStatus.BAD_REQUEST, message, cause);
    }
}
