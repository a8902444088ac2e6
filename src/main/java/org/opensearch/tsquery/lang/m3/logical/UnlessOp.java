/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.opensearch.tsquery.query.transform.NodeId;

/**
 * The {@code unless} logical operator: keeps the left-hand series whose signature does not appear on the
 * right-hand side.
 */
public final class UnlessOp {

    /** The name of this operator. */
    public static final String NAME = "unless";

    /** Creates the processors evaluating {@code unless} descriptors. */
    public static final ProcessorFactory PROCESSOR_FACTORY = UnlessNode::new;

    private UnlessOp() {}

    /**
     * Create the descriptor of an {@code unless} operation.
     *
     * @param lNode the node supplying the left block
     * @param rNode the node supplying the right block
     * @param matching the vector matching
     * @return the operator descriptor, producing {@link UnlessNode} processors
     */
    public static BaseOp create(NodeId lNode, NodeId rNode, VectorMatching matching) {
        return new BaseOp(NAME, lNode, rNode, matching, PROCESSOR_FACTORY);
    }
}
