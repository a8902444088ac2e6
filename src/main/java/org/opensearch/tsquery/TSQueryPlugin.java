/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery;

import org.opensearch.common.settings.Setting;
import org.opensearch.plugins.Plugin;

import java.util.List;

/**
 * Plugin for block-based time series query operators
 */
public class TSQueryPlugin extends Plugin {

    /**
     * The largest number of steps a block materialized by a query operator may hold.
     */
    public static final Setting<Integer> BLOCK_MAX_STEPS = Setting.intSetting("tsquery.block.max_steps", 11000, 1, Setting.Property.NodeScope);

    /**
     * Default constructor
     */
    public TSQueryPlugin() {}

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(BLOCK_MAX_STEPS);
    }
}
