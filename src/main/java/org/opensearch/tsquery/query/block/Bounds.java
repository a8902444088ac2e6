/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.block;

/**
 * Time range and resolution of a block.
 *
 * <p>{@code start} is inclusive and {@code end} exclusive, both in epoch milliseconds. A block with these
 * bounds holds one column per step of {@code stepSize} milliseconds.</p>
 *
 * @param start inclusive start timestamp
 * @param end exclusive end timestamp
 * @param stepSize distance between consecutive steps, must be positive
 */
public record Bounds(long start, long end, long stepSize) {

    /**
     * Validates the bounds.
     *
     * @throws IllegalArgumentException if the step size is not positive or end precedes start
     */
    public Bounds {
        if (stepSize <= 0) {
            throw new IllegalArgumentException("Step size must be positive, got " + stepSize);
        }
        if (end < start) {
            throw new IllegalArgumentException("End timestamp " + end + " is before start timestamp " + start);
        }
    }

    /**
     * @return the number of steps covered by these bounds
     */
    public int steps() {
        return Math.toIntExact((end - start) / stepSize);
    }

    /**
     * Timestamp of the step at the given index.
     *
     * @param index step index, starting at zero
     * @return the step timestamp
     * @throws IndexOutOfBoundsException if the index is outside the bounds
     */
    public long timeForIndex(int index) {
        if (index < 0 || index >= steps()) {
            throw new IndexOutOfBoundsException("Step index " + index + " out of bounds for " + steps() + " steps");
        }
        return start + index * stepSize;
    }
}
