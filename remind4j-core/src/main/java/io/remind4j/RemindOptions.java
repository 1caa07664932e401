package io.remind4j;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime settings for the engine.
 *
 * <ul>
 *   <li>processEvery: pause between passes in loop mode</li>
 *   <li>lockLifetime: how long a claimed schedule stays in flight before another pass may reclaim it</li>
 *   <li>maxPerPass: maximum schedules claimed by one pass; the rest wait for the next pass</li>
 *   <li>maxConsecutiveTransientFailures: transient failures in a row before a schedule is deactivated; 0 never gives up</li>
 *   <li>workerId: lock owner written on claimed rows; null generates one</li>
 *   <li>validateRecipients: reject schedules whose recipient the directory does not know</li>
 * </ul>
 */
public record RemindOptions(
        Duration processEvery,
        Duration lockLifetime,
        int maxPerPass,
        int maxConsecutiveTransientFailures,
        String workerId,
        boolean validateRecipients
) {

    public RemindOptions {
        Objects.requireNonNull(processEvery, "processEvery must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (processEvery.isZero() || processEvery.isNegative()) {
            throw new IllegalArgumentException("processEvery must be a positive duration");
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (maxPerPass <= 0) {
            throw new IllegalArgumentException("maxPerPass must be a positive number");
        }
        if (maxConsecutiveTransientFailures < 0) {
            throw new IllegalArgumentException("maxConsecutiveTransientFailures must not be negative");
        }
    }

    public static RemindOptions defaults() {
        return new RemindOptions(Duration.ofSeconds(60), Duration.ofMinutes(10), 100, 10, null, false);
    }

    public RemindOptions withWorkerId(String workerId) {
        return new RemindOptions(processEvery, lockLifetime, maxPerPass, maxConsecutiveTransientFailures,
                workerId, validateRecipients);
    }
}
