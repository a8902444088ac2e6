/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.block;

import java.util.List;

/**
 * In-memory, column-major {@link Block}. Each column holds the values of every series at one step.
 *
 * <p>Instances are created by {@link ColumnBlockBuilder} and are immutable once built.</p>
 */
public final class ColumnBlock implements Block {

    private final BlockMeta meta;
    private final List<SeriesMeta> seriesMeta;
    private final List<double[]> columns;

    ColumnBlock(BlockMeta meta, List<SeriesMeta> seriesMeta, List<double[]> columns) {
        this.meta = meta;
        this.seriesMeta = seriesMeta;
        this.columns = columns;
    }

    @Override
    public StepIter stepIter() {
        return new ColumnStepIter();
    }

    /**
     * Iterates the columns of the enclosing block in order.
     */
    private final class ColumnStepIter implements StepIter {
        private int index = -1;

        @Override
        public boolean next() {
            if (index + 1 >= columns.size()) {
                index = columns.size();
                return false;
            }
            index++;
            return true;
        }

        @Override
        public Step current() {
            if (index < 0 || index >= columns.size()) {
                throw new IllegalStateException("Iterator is not positioned on a step, index=" + index);
            }
            Bounds bounds = meta.bounds();
            return new ColumnStep(bounds.start() + index * bounds.stepSize(), columns.get(index));
        }

        @Override
        public int stepCount() {
            return columns.size();
        }

        @Override
        public List<SeriesMeta> seriesMeta() {
            return seriesMeta;
        }

        @Override
        public BlockMeta meta() {
            return meta;
        }
    }

    private record ColumnStep(long time, double[] values) implements Step {
    }
}
