/* (C)2026 */
package com.ammann.timegraph.dto;

import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.model.Segment;

/**
 * Time interval covered by a segment: time of its first row to time of its last row.
 */
public record TimeSpanDTO(double startSeconds, double endSeconds) {

    public static TimeSpanDTO of(Segment segment, NumericBuffer time) {
        return new TimeSpanDTO(time.get(segment.start()), time.get(segment.end() - 1));
    }
}
