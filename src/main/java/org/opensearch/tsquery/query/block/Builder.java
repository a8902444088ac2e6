/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.block;

import java.io.IOException;

/**
 * Write-only accumulator for a new {@link Block}.
 *
 * <p>The output series metadata is fixed when the builder is created. Callers allocate the time columns
 * with {@link #addCols(int)} and fill each column by appending one value per series, in series order.
 * Builders are single-use and not thread-safe.</p>
 */
public interface Builder {

    /**
     * Allocate additional time columns.
     *
     * @param num the number of columns to add
     * @throws IOException if the columns cannot be allocated
     */
    void addCols(int num) throws IOException;

    /**
     * Append a value to a column. Values land in the series position following the previously appended
     * value of that column.
     *
     * @param idx the column (step) index
     * @param value the value to append
     */
    void appendValue(int idx, double value);

    /**
     * @return the finished, immutable block
     */
    Block build();
}
