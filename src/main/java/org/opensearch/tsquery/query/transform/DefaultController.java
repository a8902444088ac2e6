/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.transform;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.tsquery.query.block.BlockBuilderConfig;
import org.opensearch.tsquery.query.block.BlockMeta;
import org.opensearch.tsquery.query.block.Builder;
import org.opensearch.tsquery.query.block.ColumnBlockBuilder;
import org.opensearch.tsquery.query.block.SeriesMeta;

import java.util.List;

/**
 * {@link Controller} handing out in-memory {@link ColumnBlockBuilder}s.
 */
public class DefaultController implements Controller {

    private static final Logger logger = LogManager.getLogger(DefaultController.class);

    private final NodeId id;
    private final BlockBuilderConfig config;

    /**
     * @param id the id of the owning graph node
     * @param config limits applied to every builder
     */
    public DefaultController(NodeId id, BlockBuilderConfig config) {
        this.id = id;
        this.config = config;
    }

    @Override
    public NodeId id() {
        return id;
    }

    @Override
    public Builder blockBuilder(BlockMeta meta, List<SeriesMeta> seriesMeta) {
        logger.trace("Node [{}] creating block builder for {} series", id, seriesMeta.size());
        return new ColumnBlockBuilder(meta, seriesMeta, config);
    }
}
