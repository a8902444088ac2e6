/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.opensearch.tsquery.core.model.Labels;

/**
 * Maps a tag set to the identity used to match series across the two sides of a binary operation.
 *
 * <p>Implementations are pure: equal tag sets always produce equal signatures. Distinct identities may
 * collide with a probability bounded by the 64-bit hash width.</p>
 */
@FunctionalInterface
public interface SignatureFunction {

    /**
     * @param tags the series tags
     * @return the series signature
     */
    long signature(Labels tags);
}
