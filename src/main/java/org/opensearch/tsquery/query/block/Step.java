/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.block;

/**
 * One time slice of a block.
 */
public interface Step {

    /**
     * @return the timestamp of this step in epoch milliseconds
     */
    long time();

    /**
     * Values of every series at this step, positioned like the iterator's {@link StepIter#seriesMeta()}.
     * Missing values are {@link Double#NaN}.
     *
     * @return the step values, must not be modified by callers
     */
    double[] values();
}
