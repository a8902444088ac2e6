/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.core.model;

import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ByteLabelsTests extends OpenSearchTestCase {

    public void testBasicFunctionality() {
        ByteLabels labels = ByteLabels.fromStrings("k1", "v1", "k2", "v2");

        assertEquals("v1", labels.get("k1"));
        assertEquals("v2", labels.get("k2"));
        assertEquals("", labels.get("nonexistent"));
        assertEquals("", labels.get(null));
        assertEquals("", labels.get(""));
        assertTrue(labels.has("k1"));
        assertFalse(labels.has("nonexistent"));
        assertFalse(labels.has(null));
        assertFalse(labels.has(""));
        assertFalse(labels.isEmpty());
        assertEquals(2, labels.size());

        assertEquals("k1:v1 k2:v2", labels.toKeyValueString());
        assertEquals("toString should match toKeyValueString", labels.toKeyValueString(), labels.toString());
    }

    public void testInvalidInput() {
        expectThrows(IllegalArgumentException.class, () -> ByteLabels.fromStrings("k1", "v1", "k2"));
        expectThrows(IllegalArgumentException.class, () -> ByteLabels.fromStrings("k1", null));
    }

    public void testEmptyLabels() {
        ByteLabels empty = ByteLabels.emptyLabels();
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
        assertEquals("", empty.toKeyValueString());
        assertEquals("", empty.toString());
        assertEquals("", empty.get("anything"));
        assertFalse(empty.has("anything"));

        assertEquals(empty, ByteLabels.fromMap(Map.of()));
        assertEquals(empty, ByteLabels.fromStrings());
    }

    public void testLabelSorting() {
        ByteLabels labels1 = ByteLabels.fromStrings("zebra", "z", "apple", "a");
        ByteLabels labels2 = ByteLabels.fromStrings("apple", "a", "zebra", "z");

        assertEquals(labels1.toMapView(), labels2.toMapView());
        assertEquals(labels1.stableHash(), labels2.stableHash());
        assertEquals(labels1, labels2);

        List<String> keys = new ArrayList<>();
        labels1.forEach((key, value) -> keys.add(key));
        assertEquals(List.of("apple", "zebra"), keys);
    }

    public void testStableHash() {
        ByteLabels labels1 = ByteLabels.fromStrings("k1", "v1", "k2", "v2");
        ByteLabels labels2 = ByteLabels.fromStrings("k2", "v2", "k1", "v1");
        ByteLabels labels3 = ByteLabels.fromStrings("k1", "v1", "k2", "v3");

        assertEquals(labels1.stableHash(), labels2.stableHash());
        assertEquals(labels1.hashCode(), labels2.hashCode());
        assertNotEquals(labels1.stableHash(), labels3.stableHash());
    }

    public void testLongStringEncoding() {
        // Longer than 254 bytes to exercise the extended length prefix
        String longKey = "very_long_key_" + "x".repeat(250);
        String longValue = "very_long_value_" + "y".repeat(250);

        ByteLabels labels = ByteLabels.fromStrings(longKey, longValue, "short", "val");

        assertEquals(longValue, labels.get(longKey));
        assertEquals("val", labels.get("short"));
        assertTrue(labels.has(longKey));

        ByteLabels labels2 = ByteLabels.fromMap(Map.of(longKey, longValue, "short", "val"));
        assertEquals(labels, labels2);
    }

    public void testUnicodeValues() {
        ByteLabels labels = ByteLabels.fromStrings("région", "zürich", "city", "東京");

        assertEquals("zürich", labels.get("région"));
        assertEquals("東京", labels.get("city"));
    }

    public void testEqualsAndHashCode() {
        ByteLabels labels1 = ByteLabels.fromStrings("a", "1", "b", "2");
        ByteLabels labels2 = ByteLabels.fromStrings("b", "2", "a", "1"); // Different order
        ByteLabels labels3 = ByteLabels.fromStrings("a", "1", "b", "3"); // Different value

        assertEquals("Same labels should be equal", labels1, labels2);
        assertNotEquals("Different labels should not be equal", labels1, labels3);
        assertEquals("Equal objects should have same hashCode", labels1.hashCode(), labels2.hashCode());
    }

    public void testToMapViewIsUnmodifiable() {
        ByteLabels labels = ByteLabels.fromStrings("k1", "v1");
        Map<String, String> view = labels.toMapView();

        assertEquals(Map.of("k1", "v1"), view);
        expectThrows(UnsupportedOperationException.class, () -> view.put("k2", "v2"));
    }

    public void testRandomRoundTrip() {
        Map<String, String> tags = new HashMap<>();
        int count = randomIntBetween(0, 30);
        for (int i = 0; i < count; i++) {
            tags.put(randomAlphaOfLengthBetween(1, 300), randomRealisticUnicodeOfLengthBetween(0, 300));
        }

        ByteLabels labels = ByteLabels.fromMap(tags);

        assertEquals(tags, labels.toMapView());
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            assertEquals(entry.getValue(), labels.get(entry.getKey()));
        }
    }
}
