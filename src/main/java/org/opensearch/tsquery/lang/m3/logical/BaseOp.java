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
import org.opensearch.tsquery.query.transform.Controller;
import org.opensearch.tsquery.query.transform.NodeId;

import java.io.IOException;
import java.util.Objects;

/**
 * Immutable descriptor of a logical operator in the query graph: its kind, the graph nodes supplying the
 * left and right blocks, the vector matching, and the factory binding it to a controller.
 *
 * <p>Descriptors are created once per graph compilation, usually through {@link LogicalOperatorFactory}.
 * Nothing is validated here; an unusable configuration surfaces when the processor runs.</p>
 *
 * <h2>Usage Examples:</h2>
 * <pre>{@code
 * BaseOp op = UnlessOp.create(new NodeId("0"), new NodeId("1"), VectorMatching.on("service"));
 * Processor processor = op.node(controller);
 * Block result = processor.process(leftBlock, rightBlock);
 * }</pre>
 */
public final class BaseOp implements Writeable {

    /** Argument and XContent key for the operator kind. */
    public static final String OPERATOR_TYPE_KEY = "operator";
    /** Argument and XContent key for the left node reference. */
    public static final String LHS_KEY = "lhs";
    /** Argument and XContent key for the right node reference. */
    public static final String RHS_KEY = "rhs";
    /** Argument and XContent key for the vector matching. */
    public static final String MATCHING_KEY = "matching";

    private final String operatorType;
    private final NodeId lNode;
    private final NodeId rNode;
    private final VectorMatching matching;
    private final ProcessorFactory processorFactory;

    /**
     * @param operatorType the operator kind
     * @param lNode the node supplying the left block
     * @param rNode the node supplying the right block
     * @param matching the vector matching
     * @param processorFactory creates processors for this descriptor
     */
    public BaseOp(String operatorType, NodeId lNode, NodeId rNode, VectorMatching matching, ProcessorFactory processorFactory) {
        this.operatorType = operatorType;
        this.lNode = lNode;
        this.rNode = rNode;
        this.matching = matching;
        this.processorFactory = processorFactory;
    }

    /**
     * Create a processor for this operator bound to the given controller.
     *
     * @param controller the controller of the graph node running the operator
     * @return the processor
     */
    public Processor node(Controller controller) {
        return processorFactory.create(this, controller);
    }

    /**
     * @return the operator kind
     */
    public String getOperatorType() {
        return operatorType;
    }

    /**
     * @return the node supplying the left block
     */
    public NodeId getLNode() {
        return lNode;
    }

    /**
     * @return the node supplying the right block
     */
    public NodeId getRNode() {
        return rNode;
    }

    /**
     * @return the vector matching
     */
    public VectorMatching getMatching() {
        return matching;
    }

    /**
     * Serialize this operator to XContent format.
     *
     * @param builder the XContent builder to write to
     * @param params serialization parameters
     * @throws IOException if an I/O error occurs during serialization
     */
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field(OPERATOR_TYPE_KEY, operatorType);
        builder.field(LHS_KEY, lNode.value());
        builder.field(RHS_KEY, rNode.value());
        builder.startObject(MATCHING_KEY);
        matching.toXContent(builder, params);
        builder.endObject();
    }

    /**
     * Write the operator kind, node references and matching. The processor factory is resolved again from
     * the operator kind when reading.
     *
     * @param out the stream output to write to
     * @throws IOException if an I/O error occurs while writing to the stream
     */
    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeString(operatorType);
        out.writeString(lNode.value());
        out.writeString(rNode.value());
        matching.writeTo(out);
    }

    /**
     * Create a BaseOp from the input stream for deserialization.
     *
     * @param in the stream input to read from
     * @return a new BaseOp instance
     * @throws IOException if an I/O error occurs while reading from the stream
     * @throws IllegalArgumentException if the operator kind is not registered
     */
    public static BaseOp readFrom(StreamInput in) throws IOException {
        String operatorType = in.readString();
        NodeId lNode = new NodeId(in.readString());
        NodeId rNode = new NodeId(in.readString());
        VectorMatching matching = VectorMatching.readFrom(in);
        return LogicalOperatorFactory.create(operatorType, lNode, rNode, matching);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        BaseOp that = (BaseOp) obj;
        return Objects.equals(operatorType, that.operatorType)
            && Objects.equals(lNode, that.lNode)
            && Objects.equals(rNode, that.rNode)
            && Objects.equals(matching, that.matching);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operatorType, lNode, rNode, matching);
    }

    @Override
    public String toString() {
        return operatorType + "(" + lNode + ", " + rNode + ", " + matching + ")";
    }
}
