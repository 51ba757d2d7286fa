/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.model.Segment;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a row mask into maximal runs of {@code true} rows.
 */
public final class SegmentExtractor {

    private SegmentExtractor() {}

    /**
     * Single left-to-right pass over {@code mask}.
     *
     * @return ascending, non-overlapping, non-adjacent segments {@code [start, end)}
     */
    public static List<Segment> extract(boolean[] mask) {
        List<Segment> segments = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                if (start < 0) {
                    start = i;
                }
            } else if (start >= 0) {
                segments.add(new Segment(start, i));
                start = -1;
            }
        }
        if (start >= 0) {
            segments.add(new Segment(start, mask.length));
        }
        return segments;
    }
}
