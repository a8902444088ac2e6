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
 * Identity of one series within a block.
 *
 * @param name display name of the series
 * @param tags the tag set identifying the series
 */
public record SeriesMeta(String name, Labels tags) {
}
