/* (C)2026 */
package com.ammann.timegraph.exception;

/**
 * Base unchecked exception for all engine-level errors.
 *
 * <p>Subclasses separate fatal ingestion failures from invalid queries and cancelled
 * work. Row-level and column-level defects are never raised as exceptions, they are
 * recovered and reported through the load diagnostics.
 */
public class TimeGraphException extends RuntimeException {
    public TimeGraphException(String message, Throwable cause) {
        super(message, cause);
    }

    public TimeGraphException(String message) {
        super(message);
    }
}
