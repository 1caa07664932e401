package io.remind4j.delivery;

/**
 * Result of one {@link DeliveryClient#deliver(String, String)} call.
 *
 * @param attempts      primary-path attempts made (1..maxAttempts)
 * @param viaFallback   true when the streaming transport delivered the message
 */
public record DeliveryOutcome(
        Status status,
        String reason,
        int attempts,
        boolean viaFallback
) {

    public enum Status {
        DELIVERED,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    public static DeliveryOutcome delivered(int attempts, boolean viaFallback) {
        return new DeliveryOutcome(Status.DELIVERED, null, attempts, viaFallback);
    }

    public static DeliveryOutcome transientFailure(String reason, int attempts) {
        return new DeliveryOutcome(Status.TRANSIENT_FAILURE, reason, attempts, false);
    }

    public static DeliveryOutcome permanentFailure(String reason, int attempts) {
        return new DeliveryOutcome(Status.PERMANENT_FAILURE, reason, attempts, false);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
