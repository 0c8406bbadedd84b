package io.github.shangor.gateway.server;

import io.github.shangor.gateway.config.GatewayConfig;
import io.github.shangor.gateway.cookie.CookieRelay;
import io.github.shangor.gateway.intercept.AdReferenceRewriter;
import io.github.shangor.gateway.redirect.InterstitialDetector;
import io.github.shangor.gateway.redirect.RedirectResolver;
import io.github.shangor.gateway.rewrite.ContentRewriter;
import io.github.shangor.gateway.security.TargetGuard;
import io.github.shangor.gateway.session.SessionStore;
import io.github.shangor.gateway.upstream.UpstreamClient;
import io.github.shangor.gateway.upstream.UpstreamFetcher;
import io.github.shangor.gateway.upstream.tunnel.TunnelRegistry;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The long-lived collaborators shared by every connection.
 */
public record GatewayContext(GatewayConfig config,
                             SessionStore sessions,
                             TunnelRegistry tunnels,
                             UpstreamFetcher fetcher,
                             RedirectResolver resolver,
                             ContentRewriter rewriter,
                             CookieRelay cookies,
                             TargetGuard guard,
                             AdReferenceRewriter adRewriter) {

    /**
     * Wires the gateway around an upstream client. Destroying a session closes
     * the tunnel of its current credential.
     */
    public static GatewayContext create(GatewayConfig config, UpstreamClient client, TunnelRegistry tunnels,
                                        ScheduledExecutorService scheduler) {
        SessionStore sessions = new SessionStore(config.getSessionTtl(), Clock.systemUTC(),
                session -> tunnels.close(session.credentialId()));
        TargetGuard guard = new TargetGuard();
        UpstreamFetcher fetcher = new UpstreamFetcher(config, client, tunnels, scheduler, guard);
        RedirectResolver resolver = new RedirectResolver(fetcher, new InterstitialDetector(), guard, config.getMaxRedirects());
        return new GatewayContext(config, sessions, tunnels, fetcher, resolver,
                new ContentRewriter(config.getTargetUrl()), new CookieRelay(), guard, new AdReferenceRewriter());
    }
}
