package io.github.shangor.gateway.security;

import io.github.shangor.gateway.error.SsrfBlockedException;
import io.github.shangor.gateway.util.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Refuses targets that name loopback, link-local or private hosts. Only the
 * literal host is checked: names are resolved on the upstream side, never
 * locally. Any {@code 172.*} address is refused, not just 172.16.0.0/12.
 */
public class TargetGuard {
    private static final Logger log = LoggerFactory.getLogger(TargetGuard.class);

    private static final List<String> BLOCKED_HOSTS = List.of("localhost", "0.0.0.0", "::1", "[::1]", "::", "[::]");
    private static final List<String> BLOCKED_PREFIXES = List.of("127.", "10.", "172.", "192.168.", "169.254.", "0.");
    private static final List<String> BLOCKED_SUFFIXES = List.of(".localhost");

    public boolean isBlocked(URI url) {
        String host = url.getHost();
        if (host == null) {
            return true;
        }
        return isBlockedHost(host);
    }

    public boolean isBlockedHost(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        if (h.endsWith(".")) {
            h = h.substring(0, h.length() - 1);
        }
        if (BLOCKED_HOSTS.contains(h)) {
            return true;
        }
        for (String prefix : BLOCKED_PREFIXES) {
            if (h.startsWith(prefix)) {
                return true;
            }
        }
        for (String suffix : BLOCKED_SUFFIXES) {
            if (h.endsWith(suffix)) {
                return true;
            }
        }
        // IPv6 loopback, unique-local and link-local literals
        if (h.startsWith("[")) {
            String v6 = h.substring(1, h.length() - 1);
            return v6.equals("::1") || v6.startsWith("fc") || v6.startsWith("fd") || v6.startsWith("fe80");
        }
        return false;
    }

    /**
     * Parses and checks a raw target in one go.
     *
     * @throws io.github.shangor.gateway.error.InvalidUrlException when unparsable
     * @throws SsrfBlockedException                                 when the host is internal
     */
    public URI check(String rawUrl) {
        URI url = Urls.parseAbsolute(rawUrl);
        check(url);
        return url;
    }

    public void check(URI url) {
        if (isBlocked(url)) {
            log.warn("Blocked internal target {}", url.getHost());
            throw new SsrfBlockedException(url.getHost());
        }
    }
}
