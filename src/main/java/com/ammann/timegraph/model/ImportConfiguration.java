/* (C)2026 */
package com.ammann.timegraph.model;

import com.ammann.timegraph.enumeration.EpochUnit;
import com.ammann.timegraph.enumeration.StartInstantMode;
import com.ammann.timegraph.enumeration.TimeMode;
import com.ammann.timegraph.enumeration.TimeRepresentation;
import java.time.Instant;

/**
 * User-declared parsing hints that accompany a raw table.
 *
 * <p>Only the fields relevant to {@link #timeMode()} are read; the others may be
 * {@code null}.
 *
 * @param timeMode           existing column or synthetic axis
 * @param timeColumn         designated time column (existing mode)
 * @param timeRepresentation how the time column is encoded (existing mode)
 * @param timeFormat         {@code DateTimeFormatter} pattern for {@link TimeRepresentation#FORMAT}
 * @param timeUnit           epoch unit for numeric time columns
 * @param samplingRateHz     sampling rate (synthetic mode)
 * @param startInstantMode   start of the synthetic axis
 * @param startInstant       start instant for {@link StartInstantMode#CUSTOM}
 */
public record ImportConfiguration(
        TimeMode timeMode,
        String timeColumn,
        TimeRepresentation timeRepresentation,
        String timeFormat,
        EpochUnit timeUnit,
        Double samplingRateHz,
        StartInstantMode startInstantMode,
        Instant startInstant) {

    public ImportConfiguration {
        if (timeMode == null) {
            timeMode = TimeMode.EXISTING;
        }
        if (timeRepresentation == null) {
            timeRepresentation = TimeRepresentation.AUTO;
        }
        if (timeUnit == null) {
            timeUnit = EpochUnit.AUTO;
        }
        if (startInstantMode == null) {
            startInstantMode = StartInstantMode.ZERO;
        }
    }

    /** Existing time column, representation detected automatically. */
    public static ImportConfiguration existing(String timeColumn) {
        return new ImportConfiguration(
                TimeMode.EXISTING, timeColumn, TimeRepresentation.AUTO, null, EpochUnit.AUTO, null, null, null);
    }

    /** Existing numeric epoch column in the given unit. */
    public static ImportConfiguration epoch(String timeColumn, EpochUnit unit) {
        return new ImportConfiguration(
                TimeMode.EXISTING, timeColumn, TimeRepresentation.EPOCH, null, unit, null, null, null);
    }

    /** Existing text column parsed with an explicit pattern. */
    public static ImportConfiguration formatted(String timeColumn, String pattern) {
        return new ImportConfiguration(
                TimeMode.EXISTING, timeColumn, TimeRepresentation.FORMAT, pattern, null, null, null, null);
    }

    /** Synthetic axis at {@code samplingRateHz} starting at zero. */
    public static ImportConfiguration synthetic(double samplingRateHz) {
        return synthetic(samplingRateHz, StartInstantMode.ZERO, null);
    }

    /** Synthetic axis at {@code samplingRateHz} with an explicit start. */
    public static ImportConfiguration synthetic(
            double samplingRateHz, StartInstantMode startMode, Instant startInstant) {
        return new ImportConfiguration(
                TimeMode.SYNTHETIC, null, null, null, null, samplingRateHz, startMode, startInstant);
    }
}
