package io.remind4j.core;

/**
 * Unchecked exception wrapping persistence errors raised by a {@link ScheduleStore}.
 * Fatal to the pass that hit it.
 */
public class ScheduleStoreException extends RuntimeException {
    public ScheduleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
