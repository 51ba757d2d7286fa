/* (C)2026 */
package com.ammann.timegraph.model;

/**
 * Half-open row interval {@code [start, end)}.
 */
public record RowRange(int start, int end) {

    public RowRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                    String.format("Invalid row range [%d, %d)", start, end));
        }
    }

    /** Range covering all {@code rowCount} rows. */
    public static RowRange all(int rowCount) {
        return new RowRange(0, rowCount);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Intersects this range with {@code [0, rowCount)}.
     */
    public RowRange clampTo(int rowCount) {
        int clampedEnd = Math.min(end, rowCount);
        int clampedStart = Math.min(start, clampedEnd);
        return new RowRange(clampedStart, clampedEnd);
    }
}
