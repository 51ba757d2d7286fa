/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.exception.OperationCancelledException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by long-running scans at block granularity.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** A token that is never cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Marks the token as cancelled. The shared {@link #none()} token ignores the call.
     */
    public void cancel() {
        if (this != NONE) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @param operation name used in the exception message
     * @throws OperationCancelledException if the token has been cancelled
     */
    public void throwIfCancelled(String operation) {
        if (cancelled.get()) {
            throw new OperationCancelledException(operation);
        }
    }
}
