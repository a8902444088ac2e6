/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.opensearch.common.io.stream.BytesStreamOutput;
import org.opensearch.common.xcontent.XContentFactory;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.test.AbstractWireSerializingTestCase;
import org.opensearch.tsquery.query.block.BlockBuilderConfig;
import org.opensearch.tsquery.query.transform.Controller;
import org.opensearch.tsquery.query.transform.DefaultController;
import org.opensearch.tsquery.query.transform.NodeId;

import java.io.IOException;
import java.util.List;

public class BaseOpTests extends AbstractWireSerializingTestCase<BaseOp> {

    public void testUnlessDescriptor() {
        NodeId lNode = new NodeId("lhs-node");
        NodeId rNode = new NodeId("rhs-node");
        VectorMatching matching = VectorMatching.on("service");

        BaseOp op = UnlessOp.create(lNode, rNode, matching);

        assertEquals(UnlessOp.NAME, op.getOperatorType());
        assertSame(lNode, op.getLNode());
        assertSame(rNode, op.getRNode());
        assertSame(matching, op.getMatching());
    }

    public void testNodeCreatesUnlessProcessor() {
        Controller controller = new DefaultController(new NodeId("2"), BlockBuilderConfig.DEFAULT);
        BaseOp op = UnlessOp.create(new NodeId("0"), new NodeId("1"), VectorMatching.ignoring());

        Processor first = op.node(controller);
        Processor second = op.node(controller);

        assertTrue(first instanceof UnlessNode);
        assertNotSame(first, second);
    }

    public void testCustomProcessorFactory() {
        Processor processor = (lhs, rhs) -> lhs;
        Controller controller = new DefaultController(new NodeId("2"), BlockBuilderConfig.DEFAULT);
        BaseOp[] seen = new BaseOp[1];
        BaseOp op = new BaseOp("custom", new NodeId("0"), new NodeId("1"), VectorMatching.ignoring(), (descriptor, ctl) -> {
            seen[0] = descriptor;
            assertSame(controller, ctl);
            return processor;
        });

        assertSame(processor, op.node(controller));
        assertSame(op, seen[0]);
    }

    public void testReadingUnknownOperatorFails() throws IOException {
        BaseOp op = new BaseOp("custom", new NodeId("0"), new NodeId("1"), VectorMatching.ignoring(), (descriptor, ctl) -> null);
        try (BytesStreamOutput out = new BytesStreamOutput()) {
            op.writeTo(out);
            try (StreamInput in = out.bytes().streamInput()) {
                IllegalArgumentException e = expectThrows(IllegalArgumentException.class, () -> BaseOp.readFrom(in));
                assertTrue(e.getMessage().contains("Unknown operator type: custom"));
            }
        }
    }

    public void testDeserializedDescriptorCreatesProcessors() throws IOException {
        BaseOp op = UnlessOp.create(new NodeId("0"), new NodeId("1"), VectorMatching.on("service"));
        try (BytesStreamOutput out = new BytesStreamOutput()) {
            op.writeTo(out);
            try (StreamInput in = out.bytes().streamInput()) {
                BaseOp readOp = BaseOp.readFrom(in);
                assertEquals(op, readOp);
                Processor processor = readOp.node(new DefaultController(new NodeId("2"), BlockBuilderConfig.DEFAULT));
                assertTrue(processor instanceof UnlessNode);
            }
        }
    }

    public void testToXContent() throws IOException {
        BaseOp op = UnlessOp.create(new NodeId("0"), new NodeId("1"), VectorMatching.on("service"));
        try (XContentBuilder builder = XContentFactory.jsonBuilder()) {
            builder.startObject();
            op.toXContent(builder, ToXContent.EMPTY_PARAMS);
            builder.endObject();
            assertEquals(
                "{\"operator\":\"unless\",\"lhs\":\"0\",\"rhs\":\"1\","
                    + "\"matching\":{\"card\":\"many-to-many\",\"on\":true,\"matching_labels\":[\"service\"],\"include\":[]}}",
                BytesReference.bytes(builder).utf8ToString()
            );
        }
    }

    public void testEquals() {
        BaseOp op1 = UnlessOp.create(new NodeId("0"), new NodeId("1"), VectorMatching.on("service"));
        BaseOp op2 = UnlessOp.create(new NodeId("0"), new NodeId("1"), VectorMatching.on("service"));

        assertEquals(op1, op2);
        assertEquals(op1.hashCode(), op2.hashCode());
        assertNotEquals(op1, UnlessOp.create(new NodeId("1"), new NodeId("0"), VectorMatching.on("service")));
        assertNotEquals(op1, UnlessOp.create(new NodeId("0"), new NodeId("1"), VectorMatching.ignoring("service")));
        assertNotEquals(op1, new BaseOp("custom", new NodeId("0"), new NodeId("1"), VectorMatching.on("service"), UnlessNode::new));
        assertNotEquals(null, op1);
        assertNotEquals("string", op1);
    }

    @Override
    protected Writeable.Reader<BaseOp> instanceReader() {
        return BaseOp::readFrom;
    }

    @Override
    protected BaseOp createTestInstance() {
        VectorMatching matching = new VectorMatching(
            randomFrom(VectorMatchCardinality.values()),
            randomList(0, 4, () -> randomAlphaOfLengthBetween(1, 8)),
            randomBoolean(),
            List.of()
        );
        return UnlessOp.create(new NodeId(randomAlphaOfLengthBetween(1, 10)), new NodeId(randomAlphaOfLengthBetween(1, 10)), matching);
    }
}
