/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.query.transform;

import org.opensearch.test.OpenSearchTestCase;
import org.opensearch.tsquery.core.model.ByteLabels;
import org.opensearch.tsquery.query.block.BlockBuilderConfig;
import org.opensearch.tsquery.query.block.BlockMeta;
import org.opensearch.tsquery.query.block.Bounds;
import org.opensearch.tsquery.query.block.Builder;
import org.opensearch.tsquery.query.block.SeriesMeta;
import org.opensearch.tsquery.query.block.StepIter;

import java.io.IOException;
import java.util.List;

public class DefaultControllerTests extends OpenSearchTestCase {

    public void testBlockBuilder() throws IOException {
        DefaultController controller = new DefaultController(new NodeId("7"), BlockBuilderConfig.DEFAULT);
        BlockMeta meta = new BlockMeta(new Bounds(0L, 2000L, 1000L), ByteLabels.emptyLabels());
        List<SeriesMeta> series = List.of(new SeriesMeta("a", ByteLabels.fromStrings("k", "v")));

        Builder builder = controller.blockBuilder(meta, series);
        builder.addCols(2);
        builder.appendValue(0, 1.0);
        builder.appendValue(1, 2.0);
        StepIter iter = builder.build().stepIter();

        assertEquals(new NodeId("7"), controller.id());
        assertEquals(meta, iter.meta());
        assertEquals(series, iter.seriesMeta());
        assertEquals(2, iter.stepCount());
    }

    public void testBuilderHonorsConfig() throws IOException {
        DefaultController controller = new DefaultController(new NodeId("7"), new BlockBuilderConfig(1));
        Builder builder = controller.blockBuilder(new BlockMeta(new Bounds(0L, 0L, 1L), ByteLabels.emptyLabels()), List.of());

        expectThrows(IllegalArgumentException.class, () -> builder.addCols(2));
    }

    public void testNodeId() {
        assertEquals("node-1", new NodeId("node-1").toString());
        assertEquals(new NodeId("a"), new NodeId("a"));
        expectThrows(NullPointerException.class, () -> new NodeId(null));
    }
}
