/* (C)2026 */
package com.ammann.timegraph.dto;

import com.ammann.timegraph.enumeration.EpochUnit;
import com.ammann.timegraph.enumeration.TimeMode;
import com.ammann.timegraph.enumeration.TimeRepresentation;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of time-axis resolution.
 *
 * @param mode               mode that was actually applied (fallback turns EXISTING into SYNTHETIC)
 * @param column             name of the resulting time column
 * @param representation     representation used to parse an existing column
 * @param resolvedUnit       concrete epoch unit for numeric columns
 * @param droppedRows        rows dropped because their time value could not be parsed
 * @param outOfOrderSteps    positions where time decreases; preserved, not corrected
 * @param fallbackUsed       {@code true} if the designated column was missing
 * @param samplingRateHz     sampling rate of a synthetic axis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeAxisReportDTO(
        TimeMode mode,
        String column,
        TimeRepresentation representation,
        EpochUnit resolvedUnit,
        long droppedRows,
        long outOfOrderSteps,
        boolean fallbackUsed,
        Double samplingRateHz) {

    public static TimeAxisReportDTO synthetic(String column, double samplingRateHz, boolean fallbackUsed) {
        return new TimeAxisReportDTO(
                TimeMode.SYNTHETIC, column, null, null, 0L, 0L, fallbackUsed, samplingRateHz);
    }

    public boolean hasAnomalies() {
        return droppedRows > 0 || outOfOrderSteps > 0;
    }
}
