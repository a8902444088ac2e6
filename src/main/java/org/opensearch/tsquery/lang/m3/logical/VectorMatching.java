/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Describes which labels determine series identity when the two sides of a binary operation are matched.
 *
 * <p>With {@code on == true} only the {@code matchingLabels} identify a series ({@code on(a, b)}); otherwise
 * every label except the {@code matchingLabels} does ({@code ignoring(a, b)}), so an empty label list with
 * {@code on == false} matches on the full tag set.</p>
 *
 * @param card the matching cardinality
 * @param matchingLabels the label names used by {@code on} or {@code ignoring}
 * @param on whether the labels are included (true) or excluded (false)
 * @param include additional labels carried over from the "one" side for group modifiers
 */
public record VectorMatching(VectorMatchCardinality card, List<String> matchingLabels, boolean on, List<String> include)
    implements
        Writeable {

    /** Argument key for the cardinality. */
    public static final String CARD_KEY = "card";
    /** Argument key for the matching label names. */
    public static final String MATCHING_LABELS_KEY = "matching_labels";
    /** Argument key for the on/ignoring flag. */
    public static final String ON_KEY = "on";
    /** Argument key for the group modifier labels. */
    public static final String INCLUDE_KEY = "include";

    /**
     * Copies the label lists; null lists are treated as empty.
     *
     * @throws IllegalArgumentException if card is null
     */
    public VectorMatching {
        if (card == null) {
            throw new IllegalArgumentException("Vector matching cardinality cannot be null");
        }
        matchingLabels = matchingLabels == null ? List.of() : List.copyOf(matchingLabels);
        include = include == null ? List.of() : List.copyOf(include);
    }

    /**
     * Set matching restricted to the given labels, as in {@code unless on(a, b)}.
     *
     * @param labels the identifying labels
     * @return many-to-many matching on the labels
     */
    public static VectorMatching on(String... labels) {
        return new VectorMatching(VectorMatchCardinality.MANY_TO_MANY, List.of(labels), true, List.of());
    }

    /**
     * Set matching on every label except the given ones, as in {@code unless ignoring(a, b)}.
     *
     * @param labels the labels to ignore
     * @return many-to-many matching ignoring the labels
     */
    public static VectorMatching ignoring(String... labels) {
        return new VectorMatching(VectorMatchCardinality.MANY_TO_MANY, List.of(labels), false, List.of());
    }

    /**
     * Serialize the matching fields to XContent.
     *
     * @param builder the XContent builder to write to
     * @param params serialization parameters
     * @throws IOException if an I/O error occurs during serialization
     */
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field(CARD_KEY, card.getCardinalityString());
        builder.field(ON_KEY, on);
        builder.field(MATCHING_LABELS_KEY, matchingLabels);
        builder.field(INCLUDE_KEY, include);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeEnum(card);
        out.writeStringCollection(matchingLabels);
        out.writeBoolean(on);
        out.writeStringCollection(include);
    }

    /**
     * Create a VectorMatching instance from the input stream for deserialization.
     *
     * @param in the stream input to read from
     * @return a new VectorMatching instance
     * @throws IOException if an I/O error occurs while reading from the stream
     */
    public static VectorMatching readFrom(StreamInput in) throws IOException {
        VectorMatchCardinality card = in.readEnum(VectorMatchCardinality.class);
        List<String> matchingLabels = in.readStringList();
        boolean on = in.readBoolean();
        List<String> include = in.readStringList();
        return new VectorMatching(card, matchingLabels, on, include);
    }

    /**
     * Creates a VectorMatching from planner arguments. Missing keys default to many-to-many matching on the
     * full tag set.
     *
     * @param args the argument map, may be null
     * @return the parsed matching
     * @throws IllegalArgumentException if an argument has the wrong type or an unknown cardinality
     */
    @SuppressWarnings("unchecked")
    public static VectorMatching fromArgs(Map<String, Object> args) {
        if (args == null) {
            return ignoring();
        }
        Object card = args.getOrDefault(CARD_KEY, VectorMatchCardinality.MANY_TO_MANY.getCardinalityString());
        Object on = args.getOrDefault(ON_KEY, false);
        Object matchingLabels = args.getOrDefault(MATCHING_LABELS_KEY, List.of());
        Object include = args.getOrDefault(INCLUDE_KEY, List.of());
        if (card instanceof String == false) {
            throw new IllegalArgumentException(CARD_KEY + " must be a string, got: " + card);
        }
        if (on instanceof Boolean == false) {
            throw new IllegalArgumentException(ON_KEY + " must be a boolean, got: " + on);
        }
        if (matchingLabels instanceof List == false) {
            throw new IllegalArgumentException(MATCHING_LABELS_KEY + " must be a list of label names, got: " + matchingLabels);
        }
        if (include instanceof List == false) {
            throw new IllegalArgumentException(INCLUDE_KEY + " must be a list of label names, got: " + include);
        }
        return new VectorMatching(
            VectorMatchCardinality.fromString((String) card),
            (List<String>) matchingLabels,
            (Boolean) on,
            (List<String>) include
        );
    }
}
