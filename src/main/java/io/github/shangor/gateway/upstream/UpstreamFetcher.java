package io.github.shangor.gateway.upstream;

import io.github.shangor.gateway.config.GatewayConfig;
import io.github.shangor.gateway.security.TargetGuard;
import io.github.shangor.gateway.session.SessionIds;
import io.github.shangor.gateway.session.VisitorSession;
import io.github.shangor.gateway.upstream.tunnel.TunnelRegistry;
import io.github.shangor.gateway.util.Urls;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Fetches through the visitor's pinned upstream identity.
 * <p>
 * {@link #fetch} makes one attempt with the session's current credential.
 * {@link #fetchWithRetry} closes the tunnel, rotates the credential and backs
 * off after each failed attempt. Rotation mutates the session, so callers read
 * {@link VisitorSession#credentialId()} after the returned future completes
 * rather than caching it.
 * <p>
 * HTTP statuses, 5xx included, are results; only transport failures fail the future.
 * A redirect towards a host the {@link TargetGuard} refuses is not followed: the
 * 3xx answer itself comes back as the result.
 */
public class UpstreamFetcher {
    private static final Logger log = LoggerFactory.getLogger(UpstreamFetcher.class);

    private final GatewayConfig config;
    private final UpstreamClient client;
    private final TunnelRegistry tunnels;
    private final ScheduledExecutorService scheduler;
    private final TargetGuard guard;

    public UpstreamFetcher(GatewayConfig config, UpstreamClient client, TunnelRegistry tunnels,
                           ScheduledExecutorService scheduler, TargetGuard guard) {
        this.config = config;
        this.client = client;
        this.tunnels = tunnels;
        this.scheduler = scheduler;
        this.guard = guard;
    }

    public CompletableFuture<FetchResult> fetch(URI url, VisitorSession session, FetchOptions options) {
        UpstreamCredential credential = config.credentialFor(session.credentialId());
        FetchRequest request = toRequest(url, options);
        CompletableFuture<FetchResult> result = follow(request, credential, 0, options.redirectListener());
        return result.handle((r, failure) -> {
            if (failure != null) {
                throw new UpstreamException(FetchError.from(failure));
            }
            return r;
        });
    }

    public CompletableFuture<FetchResult> fetchWithRetry(URI url, VisitorSession session, FetchOptions options) {
        return fetchWithRetry(url, session, options, config.getMaxRetries());
    }

    public CompletableFuture<FetchResult> fetchWithRetry(URI url, VisitorSession session, FetchOptions options, int maxRetries) {
        RetryPolicy policy = new RetryPolicy(maxRetries);
        CompletableFuture<FetchResult> outcome = new CompletableFuture<>();
        attempt(url, session, options, policy, 1, outcome);
        return outcome;
    }

    private void attempt(URI url, VisitorSession session, FetchOptions options, RetryPolicy policy, int attempt,
                         CompletableFuture<FetchResult> outcome) {
        String credentialId = session.credentialId();
        if (log.isDebugEnabled())
            log.debug("Fetching {} {} attempt {}/{} credential {}", options.method(), url, attempt, policy.maxAttempts(), credentialId);

        fetch(url, session, options).whenComplete((result, failure) -> {
            if (failure == null) {
                outcome.complete(result);
                return;
            }
            FetchError error = FetchError.from(failure);
            log.warn("Upstream attempt {}/{} for {} failed: {}", attempt, policy.maxAttempts(), url, error.message());
            tunnels.close(credentialId);

            switch (policy.decide(attempt, error)) {
                case RETRY -> {
                    rotate(session, credentialId);
                    scheduler.schedule(() -> attempt(url, session, options, policy, attempt + 1, outcome),
                            config.getRetryBackoffMillis(), TimeUnit.MILLISECONDS);
                }
                case GIVE_UP -> outcome.completeExceptionally(error.kind().retryable()
                        ? new UpstreamExhaustedException(url, attempt, error)
                        : new UpstreamException(error));
            }
        });
    }

    private void rotate(VisitorSession session, String expected) {
        String next = SessionIds.newCredentialId();
        if (session.rotateCredential(expected, next)) {
            log.info("Rotated upstream credential {} -> {} for {}", expected, next, session);
        } else if (log.isDebugEnabled()) {
            log.debug("Credential {} already rotated to {}", expected, session.credentialId());
        }
    }

    private CompletableFuture<FetchResult> follow(FetchRequest request, UpstreamCredential credential, int hops,
                                                  Consumer<FetchResult> onRedirect) {
        return client.execute(request, credential).thenCompose(result -> {
            if (!request.followRedirects() || !result.isRedirect()) {
                return CompletableFuture.completedFuture(result);
            }
            if (hops >= config.getMaxRedirects()) {
                log.warn("Stopped following redirects for {} after {} hops", request.url(), hops);
                return CompletableFuture.completedFuture(result);
            }
            Optional<URI> next = Urls.resolve(request.url(), result.location());
            if (next.isEmpty()) {
                return CompletableFuture.completedFuture(result);
            }
            if (guard.isBlocked(next.get())) {
                log.warn("Not following redirect from {} to internal host {}", request.url(), next.get().getHost());
                return CompletableFuture.completedFuture(result);
            }
            if (log.isDebugEnabled())
                log.debug("Following {} {} -> {}", result.status(), request.url(), next.get());
            onRedirect.accept(result);
            return follow(request.redirectTo(next.get(), result.status()), credential, hops + 1, onRedirect);
        });
    }

    static FetchRequest toRequest(URI url, FetchOptions options) {
        HttpHeaders headers = new DefaultHttpHeaders();
        options.headers().forEach(headers::set);
        if (options.cookies() != null && !options.cookies().isEmpty()) {
            headers.set(HttpHeaderNames.COOKIE, options.cookies());
        }
        return new FetchRequest(url, options.method(), headers, options.body(), options.followRedirects());
    }
}
