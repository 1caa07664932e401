package io.remind4j.delivery;

import io.remind4j.delivery.DeliveryFailureClassifier.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link DeliveryClient} with bounded retries over a {@link MessagingApi}.
 *
 * <p>Per call:
 * <ul>
 *   <li>up to {@code maxAttempts} primary sends, with {@link BackoffPolicy} pauses between them</li>
 *   <li>a permanent failure returns immediately</li>
 *   <li>a malformed-response failure is followed, within the same attempt, by exactly one streaming send</li>
 * </ul>
 */
public class RetryingDeliveryClient implements DeliveryClient {
    private static final Logger log = LoggerFactory.getLogger(RetryingDeliveryClient.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final MessagingApi api;
    private final int maxAttempts;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;

    public RetryingDeliveryClient(MessagingApi api, int maxAttempts, BackoffPolicy backoff, Sleeper sleeper) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
        this.maxAttempts = maxAttempts;
    }

    public RetryingDeliveryClient(MessagingApi api, int maxAttempts, BackoffPolicy backoff) {
        this(api, maxAttempts, backoff, Sleeper.THREAD);
    }

    @Override
    public DeliveryOutcome deliver(String recipientId, String message) {
        Objects.requireNonNull(recipientId, "recipientId must not be null");
        Objects.requireNonNull(message, "message must not be null");

        String lastReason = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                log.debug("remind delivery attempt recipient={} attempt={}/{} length={}",
                        recipientId, attempt, maxAttempts, message.length());
                api.send(recipientId, message);
                log.info("remind delivered recipient={} attempt={}", recipientId, attempt);
                return DeliveryOutcome.delivered(attempt, false);
            } catch (MessagingApiException ex) {
                FailureKind kind = DeliveryFailureClassifier.classify(ex);
                lastReason = DeliveryFailureClassifier.describe(ex);
                log.warn("remind delivery attempt failed recipient={} attempt={}/{} kind={} reason={}",
                        recipientId, attempt, maxAttempts, kind, lastReason);

                if (kind == FailureKind.PERMANENT) {
                    return DeliveryOutcome.permanentFailure(lastReason, attempt);
                }

                if (kind == FailureKind.MALFORMED_RESPONSE) {
                    try {
                        log.info("remind malformed response detected, trying streaming transport recipient={}", recipientId);
                        api.sendStreaming(recipientId, message);
                        log.info("remind delivered via streaming transport recipient={} attempt={}", recipientId, attempt);
                        return DeliveryOutcome.delivered(attempt, true);
                    } catch (MessagingApiException streamEx) {
                        lastReason = "streaming fallback failed: " + DeliveryFailureClassifier.describe(streamEx);
                        log.warn("remind streaming fallback failed recipient={} attempt={} reason={}",
                                recipientId, attempt, lastReason);
                        if (DeliveryFailureClassifier.classify(streamEx) == FailureKind.PERMANENT) {
                            return DeliveryOutcome.permanentFailure(lastReason, attempt);
                        }
                    }
                }
            }

            if (attempt < maxAttempts) {
                Duration pause = backoff.delayAfter(attempt);
                try {
                    sleeper.sleep(pause);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return DeliveryOutcome.transientFailure("interrupted while backing off: " + lastReason, attempt);
                }
            }
        }

        log.error("remind delivery exhausted retries recipient={} attempts={} reason={}", recipientId, maxAttempts, lastReason);
        return DeliveryOutcome.transientFailure(lastReason, maxAttempts);
    }
}
