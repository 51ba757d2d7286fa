/* (C)2026 */
package com.ammann.timegraph.service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Side-effect-free numeric parse of a column's cells.
 *
 * <p>The probe never throws for bad tokens. It returns the success rate together with
 * the parsed-or-missing array so that the coercion decision can be taken (and tested)
 * separately from the parsing.
 */
public final class NumericProbe {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern INFINITY =
            Pattern.compile("([+-]?)(?:inf|infinity)", Pattern.CASE_INSENSITIVE);

    private NumericProbe() {}

    /**
     * Parses every non-missing cell. {@code null} cells are missing and are not counted
     * in the denominator of the success rate.
     *
     * @param cells canonical cells: {@code null}, {@link String} or {@link Number}
     * @return probe result; {@code parsed} holds {@code NaN} for missing and failed cells
     */
    public static ProbeResult probe(List<Object> cells) {
        double[] parsed = new double[cells.size()];
        int nonMissing = 0;
        int parsedCount = 0;
        int infinite = 0;

        for (int i = 0; i < parsed.length; i++) {
            Object cell = cells.get(i);
            if (cell == null) {
                parsed[i] = Double.NaN;
                continue;
            }
            nonMissing++;
            double value = parseCell(cell);
            parsed[i] = value;
            if (!Double.isNaN(value)) {
                parsedCount++;
                if (Double.isInfinite(value)) {
                    infinite++;
                }
            }
        }

        double successRate = nonMissing == 0 ? 0.0 : (double) parsedCount / nonMissing;
        return new ProbeResult(successRate, parsed, parsedCount, nonMissing, infinite);
    }

    /**
     * Parses one cell. Returns {@code NaN} if the cell is not a number.
     */
    public static double parseCell(Object cell) {
        if (cell instanceof Number number) {
            return number.doubleValue();
        }
        if (cell == null) {
            return Double.NaN;
        }
        return parseToken(cell.toString());
    }

    /**
     * Parses a decimal token. Hexadecimal floats and Java type suffixes ({@code 1d},
     * {@code 2f}) are rejected; {@code inf} and {@code infinity} yield signed infinities.
     */
    public static double parseToken(String token) {
        String trimmed = token.trim();
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        var infinity = INFINITY.matcher(trimmed);
        if (infinity.matches()) {
            return "-".equals(infinity.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.NaN;
    }

    /**
     * Outcome of a probe.
     *
     * @param successRate     parsed cells divided by non-missing cells, {@code 0} if none
     * @param parsed          parsed values, {@code NaN} where missing or unparseable
     * @param parsedCount     cells that parsed (infinities included)
     * @param nonMissingCount cells that were not missing
     * @param infiniteCount   cells that parsed to an infinity
     */
    public record ProbeResult(
            double successRate, double[] parsed, int parsedCount, int nonMissingCount, int infiniteCount) {

        /** Cells that were present but did not parse. */
        public int failedCount() {
            return nonMissingCount - parsedCount;
        }
    }
}
