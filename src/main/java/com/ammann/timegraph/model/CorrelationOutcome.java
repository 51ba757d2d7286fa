/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.enumeration.SkipReason;
import java.util.Objects;

/**
 * Result of correlating two buffers: either a coefficient or the reason it was skipped.
 */
public sealed interface CorrelationOutcome
        permits CorrelationOutcome.Correlated, CorrelationOutcome.Skipped {

    boolean isSkipped();

    static CorrelationOutcome correlated(double coefficient, int sampleCount) {
        return new Correlated(coefficient, sampleCount);
    }

    static CorrelationOutcome skipped(SkipReason reason) {
        return new Skipped(reason);
    }

    /**
     * Pearson coefficient over {@code sampleCount} rows where both inputs were finite.
     */
    record Correlated(double coefficient, int sampleCount) implements CorrelationOutcome {
        @Override
        public boolean isSkipped() {
            return false;
        }
    }

    /** The pair was excluded. */
    record Skipped(SkipReason reason) implements CorrelationOutcome {
        public Skipped {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isSkipped() {
            return true;
        }
    }
}
