/* (C)2026 */
package com.ammann.timegraph.exception;

/**
 * Signals that a long-running scan observed its cancellation flag and stopped early.
 *
 * <p>Callers treat it as "result no longer wanted", not as a failure.
 */
public class OperationCancelledException extends TimeGraphException {

    public OperationCancelledException(String operation) {
        super(String.format("%s was cancelled", operation));
    }
}
