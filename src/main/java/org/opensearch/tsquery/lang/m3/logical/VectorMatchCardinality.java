/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

/**
 * Cardinality of the series matching between the two sides of a binary operation.
 */
public enum VectorMatchCardinality {

    /**
     * Each left series matches at most one right series.
     */
    ONE_TO_ONE("one-to-one"),

    /**
     * Many left series may match the same right series.
     */
    MANY_TO_ONE("many-to-one"),

    /**
     * One left series may match many right series.
     */
    ONE_TO_MANY("one-to-many"),

    /**
     * Set semantics, used by the logical operators.
     */
    MANY_TO_MANY("many-to-many");

    private final String cardinalityString;

    VectorMatchCardinality(String cardinalityString) {
        this.cardinalityString = cardinalityString;
    }

    /**
     * Gets the string representation of this cardinality
     * @return the cardinality string (e.g., "one-to-one")
     */
    public String getCardinalityString() {
        return cardinalityString;
    }

    /**
     * Parse a string into a VectorMatchCardinality value.
     *
     * @param cardinalityString the string representation of the cardinality
     * @return the corresponding VectorMatchCardinality value
     * @throws IllegalArgumentException if the cardinality is not recognized
     */
    public static VectorMatchCardinality fromString(String cardinalityString) {
        if (cardinalityString == null) {
            throw new IllegalArgumentException("Cardinality string cannot be null");
        }

        return switch (cardinalityString.trim()) {
            case "one-to-one" -> ONE_TO_ONE;
            case "many-to-one" -> MANY_TO_ONE;
            case "one-to-many" -> ONE_TO_MANY;
            case "many-to-many" -> MANY_TO_MANY;
            default -> throw new IllegalArgumentException(
                "Unknown vector matching cardinality: "
                    + cardinalityString
                    + ". Supported cardinalities: one-to-one, many-to-one, one-to-many, many-to-many"
            );
        };
    }
}
