package io.remind4j.core;

/**
 * A stored schedule whose spec can no longer be evaluated. Fatal for that schedule only.
 */
public class ScheduleIntegrityException extends RuntimeException {
    private final String scheduleId;

    public ScheduleIntegrityException(String scheduleId, String message, Throwable cause) {
        super(message, cause);
        this.scheduleId = scheduleId;
    }

    public ScheduleIntegrityException(String scheduleId, String message) {
        this(scheduleId, message, null);
    }

    public String scheduleId() {
        return scheduleId;
    }
}
