/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.block;

import java.io.IOException;
import java.util.List;

/**
 * Forward-only cursor over the time axis of a block.
 *
 * <p>The cursor starts before the first step; each successful {@link #next()} moves it one step forward,
 * and it is exhausted after {@link #stepCount()} advances. The series metadata and block metadata are
 * fixed for the lifetime of the iterator.</p>
 */
public interface StepIter {

    /**
     * Advance to the next step.
     *
     * @return false once the iterator is exhausted
     */
    boolean next();

    /**
     * @return the step the cursor is positioned on
     * @throws IOException if the step cannot be read
     */
    Step current() throws IOException;

    /**
     * @return the total number of steps this iterator will produce
     */
    int stepCount();

    /**
     * @return the ordered metadata of the series in this block
     */
    List<SeriesMeta> seriesMeta();

    /**
     * @return the block-level metadata
     */
    BlockMeta meta();
}
