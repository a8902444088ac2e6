/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.core.model;

/**
 * Constants shared by label implementations.
 */
public final class LabelConstants {

    /** Separator between a label key and its value in rendered label strings. */
    public static final char LABEL_DELIMITER = ':';

    /** Separator between rendered key/value pairs. */
    public static final char PAIR_SEPARATOR = ' ';

    /** Length prefix marker announcing a 4-byte length for strings of 255 bytes or more. */
    static final int EXTENDED_LENGTH_MARKER = 0xFF;

    private LabelConstants() {}
}
