package io.github.shangor.gateway.upstream;

/**
 * Pure retry decision: given the attempt that just failed and why, retry with
 * a rotated credential or give up.
 */
public final class RetryPolicy {

    public enum Decision {
        RETRY,
        GIVE_UP
    }

    private final int maxAttempts;

    public RetryPolicy(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param attempt 1-based number of the attempt that failed
     */
    public Decision decide(int attempt, FetchError error) {
        if (!error.kind().retryable()) {
            return Decision.GIVE_UP;
        }
        return attempt < maxAttempts ? Decision.RETRY : Decision.GIVE_UP;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
