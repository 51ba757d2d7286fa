/* (C)2026 */
package com.ammann.timegraph.dto;

import com.ammann.timegraph.enumeration.SkipReason;
import com.ammann.timegraph.model.CorrelationOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One pair of a correlation batch: either a coefficient or a skip reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CorrelationEntryDTO(
        String first, String second, Double coefficient, Integer sampleCount, SkipReason skipReason) {

    public static CorrelationEntryDTO from(String first, String second, CorrelationOutcome outcome) {
        if (outcome instanceof CorrelationOutcome.Correlated correlated) {
            return new CorrelationEntryDTO(
                    first, second, correlated.coefficient(), correlated.sampleCount(), null);
        }
        CorrelationOutcome.Skipped skipped = (CorrelationOutcome.Skipped) outcome;
        return new CorrelationEntryDTO(first, second, null, null, skipped.reason());
    }

    public boolean skipped() {
        return skipReason != null;
    }
}
