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
 * A time-aligned collection of series. Blocks are immutable; every call to {@link #stepIter()} returns a
 * fresh, independent iterator.
 */
public interface Block {

    /**
     * Open an iterator over the steps of this block.
     *
     * @return a new step iterator
     * @throws IOException if the block cannot be read
     */
    StepIter stepIter() throws IOException;
}
