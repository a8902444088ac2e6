/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.opensearch.common.hash.MurmurHash3;

import java.util.List;
import java.util.Set;

/**
 * Factory for {@link SignatureFunction}s.
 */
public final class Signatures {

    // 0xFF never occurs in UTF-8, so it cannot be confused with label content.
    private static final byte SEPARATOR = (byte) 0xFF;

    private Signatures() {}

    /**
     * Signature function for the given matching configuration.
     *
     * @param matching the vector matching
     * @return the signature function
     */
    public static SignatureFunction forMatching(VectorMatching matching) {
        return hashFunc(matching.on(), matching.matchingLabels());
    }

    /**
     * Signature function hashing either only the named labels ({@code on == true}) or every label except the
     * named ones ({@code on == false}).
     *
     * <p>Participating labels are hashed in ascending key order as {@code key 0xFF value 0xFF} using
     * MurmurHash3 x64/128 with seed 0, keeping the first 64 bits. Named labels absent from a tag set do not
     * contribute.</p>
     *
     * @param on whether the names select (true) or exclude (false) labels
     * @param names the label names
     * @return the signature function
     */
    public static SignatureFunction hashFunc(boolean on, List<String> names) {
        Set<String> nameSet = Set.copyOf(names);
        return tags -> {
            BytesRefBuilder buffer = new BytesRefBuilder();
            tags.forEach((key, value) -> {
                if (nameSet.contains(key) == on) {
                    buffer.append(new BytesRef(key));
                    buffer.append(SEPARATOR);
                    buffer.append(new BytesRef(value));
                    buffer.append(SEPARATOR);
                }
            });
            return MurmurHash3.hash128(buffer.bytes(), 0, buffer.length(), 0, new MurmurHash3.Hash128()).h1;
        };
    }
}
