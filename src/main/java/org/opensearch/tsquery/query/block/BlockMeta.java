/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.block;

import org.opensearch.tsquery.core.model.Labels;

/**
 * Block-level metadata shared by every series of a block.
 *
 * @param bounds the time bounds of the block
 * @param tags tags common to all series in the block
 */
public record BlockMeta(Bounds bounds, Labels tags) {
}
