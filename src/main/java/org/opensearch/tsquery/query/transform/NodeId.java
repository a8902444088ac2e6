/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.transform;

import java.util.Objects;

/**
 * Identifier of a node in the query execution graph, assigned by the planner.
 *
 * @param value the identifier
 */
public record NodeId(String value) {

    /**
     * @throws NullPointerException if value is null
     */
    public NodeId {
        Objects.requireNonNull(value, "Node id cannot be null");
    }

    @Override
    public String toString() {
        return value;
    }
}
