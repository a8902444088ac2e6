/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.core.model;

import java.util.Map;
import java.util.function.BiConsumer;

/**
 * The tag set identifying a single time series.
 *
 * <p>A label set is unordered from the caller's point of view: two label sets holding the same
 * key/value pairs are equal regardless of the order they were supplied in. Implementations expose
 * the pairs in ascending key order so that anything derived from them (strings, hashes,
 * signatures) is deterministic.</p>
 */
public interface Labels {

    /**
     * Get the value of a label.
     *
     * @param name the label key
     * @return the label value, or an empty string if the label is absent
     */
    String get(String name);

    /**
     * Check whether a label is present.
     *
     * @param name the label key
     * @return true if the label exists
     */
    boolean has(String name);

    /**
     * @return true if there are no labels
     */
    boolean isEmpty();

    /**
     * @return the number of key/value pairs
     */
    int size();

    /**
     * Visit every key/value pair in ascending key order.
     *
     * @param consumer receives each key and value
     */
    void forEach(BiConsumer<String, String> consumer);

    /**
     * @return an unmodifiable, key-sorted map view of the labels
     */
    Map<String, String> toMapView();

    /**
     * @return the labels rendered as {@code key:value} pairs separated by spaces, in key order
     */
    String toKeyValueString();

    /**
     * A hash of the label set that does not depend on the JVM instance or on insertion order.
     *
     * @return 64-bit stable hash
     */
    long stableHash();
}
