/* (C)2026 */
package com.ammann.timegraph.dto;

import java.util.List;
import java.util.Optional;

/**
 * Pairwise correlations of a set of signals. Each unordered pair appears once, in the
 * order the signals were given.
 */
public record CorrelationMatrixDTO(List<String> signals, List<CorrelationEntryDTO> entries) {

    public CorrelationMatrixDTO {
        signals = List.copyOf(signals);
        entries = List.copyOf(entries);
    }

    /**
     * Finds the entry for a pair regardless of argument order.
     */
    public Optional<CorrelationEntryDTO> entry(String a, String b) {
        return entries.stream()
                .filter(e -> (e.first().equals(a) && e.second().equals(b))
                        || (e.first().equals(b) && e.second().equals(a)))
                .findFirst();
    }

    public long skippedCount() {
        return entries.stream().filter(CorrelationEntryDTO::skipped).count();
    }
}
