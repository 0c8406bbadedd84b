package io.github.shangor.gateway.upstream;

import java.net.InetSocketAddress;

/**
 * SOCKS5 login for one sticky-session id. Never log {@link #password()}.
 */
public record UpstreamCredential(String credentialId, String host, int port, String username, String password) {

    public InetSocketAddress proxyAddress() {
        return new InetSocketAddress(host, port);
    }

    public boolean hasAuth() {
        return username != null && password != null;
    }

    @Override
    public String toString() {
        return "socks5://" + (username != null ? username + ":***@" : "") + host + ":" + port;
    }
}
