/* (C)2026 */
package com.ammann.timegraph.model;

/**
 * Maximal run of rows {@code [start, end)} for which a combined filter predicate holds.
 */
public record Segment(int start, int end) {

    public Segment {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException(
                    String.format("Invalid segment [%d, %d)", start, end));
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int row) {
        return row >= start && row < end;
    }
}
