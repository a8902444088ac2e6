/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.opensearch.tsquery.query.transform.Controller;

/**
 * Binds an operator descriptor to a controller.
 */
@FunctionalInterface
public interface ProcessorFactory {

    /**
     * @param op the operator descriptor
     * @param controller the controller of the graph node running the operator
     * @return a ready processor
     */
    Processor create(BaseOp op, Controller controller);
}
