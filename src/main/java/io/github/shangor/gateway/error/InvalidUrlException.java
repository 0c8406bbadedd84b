package io.github.shangor.gateway.error;

import io.netty.handler.codec.http.HttpResponseStatus;

public class InvalidUrlException extends GatewayException {
    private final String url;

    public InvalidUrlException(String url) {
        super(HttpResponseStatus.BAD_REQUEST, "Invalid URL: " + url);
        this.url = url;
    }

    public InvalidUrlException(String url, Throwable cause) {
        super(HttpResponseStatus.BAD_REQUEST, "Invalid URL: " + url, cause);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
