/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.opensearch.tsquery.query.block.Block;

import java.io.IOException;

/**
 * Evaluates a binary operation over two realized blocks.
 *
 * <p>Every operator kind registered in {@link LogicalOperatorFactory} provides an implementation. A processor
 * holds only its immutable configuration and controller, so a single instance may serve concurrent calls
 * on independent block pairs.</p>
 */
public interface Processor {

    /**
     * Combine the left and right blocks into a new block. The inputs are never modified.
     *
     * @param lhs the left operand
     * @param rhs the right operand
     * @return the result block
     * @throws IOException if reading an input or building the output fails
     * @throws BlockMismatchException if the inputs cannot be combined
     */
    Block process(Block lhs, Block rhs) throws IOException;
}
