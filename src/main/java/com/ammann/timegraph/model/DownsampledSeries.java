/* (C)2026 */
package com.ammann.timegraph.model;

/**
 * Display-sized subset of a buffer: the kept row indices and their values.
 *
 * @param indices ascending row indices into the source buffer
 * @param values  buffer values at {@code indices}
 */
public record DownsampledSeries(int[] indices, double[] values) {

    public int size() {
        return indices.length;
    }
}
