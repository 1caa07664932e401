package io.remind4j.delivery;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff without jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(failedAttempts-1)}, capped at {@code maxDelay}.
 */
public final class ExponentialBackoff implements BackoffPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoff(Duration baseDelay, Duration maxDelay) {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0, got: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
        }
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
    }

    @Override
    public Duration delayAfter(int failedAttempts) {
        if (failedAttempts <= 0 || baseDelayMs == 0) {
            return Duration.ZERO;
        }
        int exp = Math.min(failedAttempts - 1, 30);
        long shift = 1L << exp;
        // cap before multiplying to avoid overflow
        long ms = shift > maxDelayMs / baseDelayMs ? maxDelayMs : baseDelayMs * shift;
        return Duration.ofMillis(Math.min(ms, maxDelayMs));
    }
}
