package io.remind4j.core;

/**
 * Result of cancelling a schedule by id.
 *
 * CANCELLED        : schedule was active and is now inactive
 * ALREADY_INACTIVE : schedule exists but was already inactive
 * NOT_FOUND        : no schedule with that id
 */
public enum CancelResult {
    CANCELLED,
    ALREADY_INACTIVE,
    NOT_FOUND;

    public boolean found() {
        return this != NOT_FOUND;
    }
}
