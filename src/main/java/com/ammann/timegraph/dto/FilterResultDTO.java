/* (C)2026 */
package com.ammann.timegraph.dto;

import com.ammann.timegraph.model.Segment;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Segments matching a filter, ascending and non-overlapping, plus the conditions that
 * could not be evaluated.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record FilterResultDTO(
        List<Segment> segments,
        long matchedRows,
        long totalRows,
        List<SkippedConditionDTO> skippedConditions,
        List<TimeSpanDTO> timeSpans) {

    public FilterResultDTO {
        segments = List.copyOf(segments);
        skippedConditions = skippedConditions == null ? List.of() : List.copyOf(skippedConditions);
        timeSpans = timeSpans == null ? List.of() : List.copyOf(timeSpans);
    }

    public FilterResultDTO withTimeSpans(List<TimeSpanDTO> spans) {
        return new FilterResultDTO(segments, matchedRows, totalRows, skippedConditions, spans);
    }

    public double matchedFraction() {
        return totalRows == 0 ? 0.0 : (double) matchedRows / totalRows;
    }
}
