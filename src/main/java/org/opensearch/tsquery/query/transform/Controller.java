/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.transform;

import org.opensearch.tsquery.query.block.BlockMeta;
import org.opensearch.tsquery.query.block.Builder;
import org.opensearch.tsquery.query.block.SeriesMeta;

import java.io.IOException;
import java.util.List;

/**
 * Execution-side handle given to an operator when it is bound into a query graph. Operators use it to
 * obtain builders for the blocks they emit.
 */
public interface Controller {

    /**
     * @return the id of the graph node this controller belongs to
     */
    NodeId id();

    /**
     * Create a builder for an output block.
     *
     * @param meta the block-level metadata of the output
     * @param seriesMeta the ordered series metadata of the output
     * @return a fresh builder
     * @throws IOException if the builder cannot be created
     */
    Builder blockBuilder(BlockMeta meta, List<SeriesMeta> seriesMeta) throws IOException;
}
