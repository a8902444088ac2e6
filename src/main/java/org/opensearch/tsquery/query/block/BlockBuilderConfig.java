/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.block;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.Settings;
import org.opensearch.tsquery.TSQueryPlugin;

/**
 * Limits applied by {@link ColumnBlockBuilder} when materializing blocks.
 *
 * <h2>Settings:</h2>
 * <p>Settings are defined in {@link TSQueryPlugin}:</p>
 * <ul>
 *   <li>{@link TSQueryPlugin#BLOCK_MAX_STEPS}</li>
 * </ul>
 *
 * @param maxSteps the largest number of time columns a single block may allocate
 */
public record BlockBuilderConfig(int maxSteps) {

    private static final Logger logger = LogManager.getLogger(BlockBuilderConfig.class);

    /** Configuration matching the setting defaults. */
    public static final BlockBuilderConfig DEFAULT = new BlockBuilderConfig(TSQueryPlugin.BLOCK_MAX_STEPS.getDefault(Settings.EMPTY));

    /**
     * Validates the limits.
     *
     * @throws IllegalArgumentException if maxSteps is not positive
     */
    public BlockBuilderConfig {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
    }

    /**
     * Read the block builder configuration from node settings.
     *
     * @param settings the node settings
     * @return the configuration
     */
    public static BlockBuilderConfig fromSettings(Settings settings) {
        BlockBuilderConfig config = new BlockBuilderConfig(TSQueryPlugin.BLOCK_MAX_STEPS.get(settings));
        logger.info("Initialized block builder config: maxSteps={}", config.maxSteps());
        return config;
    }
}
