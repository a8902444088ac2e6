/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.core.model;

import org.opensearch.common.hash.MurmurHash3;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * {@link Labels} implementation that keeps all key/value pairs, sorted by key, in a single byte array.
 *
 * <p>Each key and value is stored as a length-prefixed UTF-8 string. Lengths below 255 take a single
 * byte; longer strings are written as the {@code 0xFF} marker followed by a 4-byte big-endian length.
 * Because the pairs are sorted before encoding, equality and hashing operate directly on the bytes.</p>
 *
 * <pre>{@code
 * Labels labels = ByteLabels.fromStrings("service", "api", "region", "us-east");
 * labels.get("region");       // "us-east"
 * labels.toKeyValueString();  // "region:us-east service:api"
 * }</pre>
 */
public final class ByteLabels implements Labels {

    private static final ByteLabels EMPTY = new ByteLabels(new byte[0], 0);

    private final byte[] data;
    private final int size;

    private ByteLabels(byte[] data, int size) {
        this.data = data;
        this.size = size;
    }

    /**
     * @return the shared empty label set
     */
    public static ByteLabels emptyLabels() {
        return EMPTY;
    }

    /**
     * Create labels from alternating key and value strings.
     *
     * @param keyValuePairs key1, value1, key2, value2, ...
     * @return the encoded labels
     * @throws IllegalArgumentException if an odd number of strings is supplied
     */
    public static ByteLabels fromStrings(String... keyValuePairs) {
        if (keyValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Labels must be provided as key/value pairs, got " + keyValuePairs.length + " strings");
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            sorted.put(requireNonNull(keyValuePairs[i]), requireNonNull(keyValuePairs[i + 1]));
        }
        return encode(sorted);
    }

    /**
     * Create labels from a map.
     *
     * @param labels the key/value pairs
     * @return the encoded labels
     */
    public static ByteLabels fromMap(Map<String, String> labels) {
        if (labels.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            sorted.put(requireNonNull(entry.getKey()), requireNonNull(entry.getValue()));
        }
        return encode(sorted);
    }

    private static String requireNonNull(String s) {
        if (s == null) {
            throw new IllegalArgumentException("Label keys and values cannot be null");
        }
        return s;
    }

    private static ByteLabels encode(TreeMap<String, String> sorted) {
        if (sorted.isEmpty()) {
            return EMPTY;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            writeString(out, entry.getKey());
            writeString(out, entry.getValue());
        }
        return new ByteLabels(out.toByteArray(), sorted.size());
    }

    private static void writeString(ByteArrayOutputStream out, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < LabelConstants.EXTENDED_LENGTH_MARKER) {
            out.write(bytes.length);
        } else {
            out.write(LabelConstants.EXTENDED_LENGTH_MARKER);
            out.write(bytes.length >>> 24);
            out.write(bytes.length >>> 16);
            out.write(bytes.length >>> 8);
            out.write(bytes.length);
        }
        out.write(bytes, 0, bytes.length);
    }

    @Override
    public String get(String name) {
        String value = find(name);
        return value == null ? "" : value;
    }

    @Override
    public boolean has(String name) {
        return find(name) != null;
    }

    private String find(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        String[] found = new String[1];
        forEach((key, value) -> {
            if (found[0] == null && key.equals(name)) {
                found[0] = value;
            }
        });
        return found[0];
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public void forEach(BiConsumer<String, String> consumer) {
        int pos = 0;
        while (pos < data.length) {
            int keyLength = readLength(pos);
            pos += headerSize(keyLength);
            String key = new String(data, pos, keyLength, StandardCharsets.UTF_8);
            pos += keyLength;

            int valueLength = readLength(pos);
            pos += headerSize(valueLength);
            String value = new String(data, pos, valueLength, StandardCharsets.UTF_8);
            pos += valueLength;

            consumer.accept(key, value);
        }
    }

    private int readLength(int pos) {
        int first = data[pos] & 0xFF;
        if (first < LabelConstants.EXTENDED_LENGTH_MARKER) {
            return first;
        }
        return ((data[pos + 1] & 0xFF) << 24) | ((data[pos + 2] & 0xFF) << 16) | ((data[pos + 3] & 0xFF) << 8) | (data[pos + 4] & 0xFF);
    }

    private static int headerSize(int length) {
        return length < LabelConstants.EXTENDED_LENGTH_MARKER ? 1 : 5;
    }

    @Override
    public Map<String, String> toMapView() {
        TreeMap<String, String> map = new TreeMap<>();
        forEach(map::put);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toKeyValueString() {
        StringBuilder sb = new StringBuilder();
        forEach((key, value) -> {
            if (sb.length() > 0) {
                sb.append(LabelConstants.PAIR_SEPARATOR);
            }
            sb.append(key).append(LabelConstants.LABEL_DELIMITER).append(value);
        });
        return sb.toString();
    }

    @Override
    public long stableHash() {
        return MurmurHash3.hash128(data, 0, data.length, 0, new MurmurHash3.Hash128()).h1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(data, ((ByteLabels) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return toKeyValueString();
    }
}
