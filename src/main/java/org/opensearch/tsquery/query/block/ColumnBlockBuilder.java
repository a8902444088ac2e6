/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.block;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link Builder} producing {@link ColumnBlock}s.
 *
 * <p>Each allocated column has room for exactly one value per output series. Values that were never
 * appended are {@link Double#NaN} in the built block.</p>
 */
public final class ColumnBlockBuilder implements Builder {

    private final BlockMeta meta;
    private final List<SeriesMeta> seriesMeta;
    private final BlockBuilderConfig config;
    private final List<double[]> columns = new ArrayList<>();
    private final List<Integer> columnSizes = new ArrayList<>();
    private boolean built;

    /**
     * Create a builder for a block with the given metadata.
     *
     * @param meta the block-level metadata of the output
     * @param seriesMeta the ordered series metadata of the output
     * @param config the allocation limits
     */
    public ColumnBlockBuilder(BlockMeta meta, List<SeriesMeta> seriesMeta, BlockBuilderConfig config) {
        this.meta = meta;
        this.seriesMeta = List.copyOf(seriesMeta);
        this.config = config;
    }

    /**
     * @throws IllegalArgumentException if num is negative or the total would exceed {@link BlockBuilderConfig#maxSteps()}
     */
    @Override
    public void addCols(int num) {
        if (num < 0) {
            throw new IllegalArgumentException("Cannot add a negative number of columns: " + num);
        }
        if (columns.size() + num > config.maxSteps()) {
            throw new IllegalArgumentException(
                "Block would have " + (columns.size() + num) + " steps, exceeding the limit of " + config.maxSteps()
            );
        }
        for (int i = 0; i < num; i++) {
            double[] column = new double[seriesMeta.size()];
            Arrays.fill(column, Double.NaN);
            columns.add(column);
            columnSizes.add(0);
        }
    }

    /**
     * @throws IllegalStateException if the column was not allocated or is already full
     */
    @Override
    public void appendValue(int idx, double value) {
        if (idx < 0 || idx >= columns.size()) {
            throw new IllegalStateException("Column " + idx + " is not allocated, block has " + columns.size() + " columns");
        }
        int size = columnSizes.get(idx);
        double[] column = columns.get(idx);
        if (size >= column.length) {
            throw new IllegalStateException("Column " + idx + " already holds " + column.length + " values");
        }
        column[size] = value;
        columnSizes.set(idx, size + 1);
    }

    /**
     * @throws IllegalStateException if the builder was already built
     */
    @Override
    public Block build() {
        if (built) {
            throw new IllegalStateException("Block has already been built");
        }
        built = true;
        return new ColumnBlock(meta, seriesMeta, List.copyOf(columns));
    }
}
