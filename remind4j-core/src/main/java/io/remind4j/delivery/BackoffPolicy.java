package io.remind4j.delivery;

import java.time.Duration;

/**
 * Strategy for computing the pause before the next delivery attempt.
 *
 * @see ExponentialBackoff
 */
public interface BackoffPolicy {

    /**
     * @param failedAttempts attempts that have failed so far (1-based)
     */
    Duration delayAfter(int failedAttempts);
}
