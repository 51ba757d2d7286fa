/* (C)2026 */
package com.ammann.timegraph.model;

/**
 * Render-ready series: row indices, x values from the time axis and y values.
 */
public record SeriesView(String signal, int[] indices, double[] times, double[] values) {

    public int size() {
        return indices.length;
    }
}
