/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.opensearch.tsquery.query.transform.NodeId;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Registry of logical operators keyed by operator kind.
 *
 * <p>The registry is populated once during class initialization and is read-only afterwards, so it can be
 * used concurrently without synchronization.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * BaseOp op = LogicalOperatorFactory.createWithArgs("unless", Map.of("lhs", "0", "rhs", "1"));
 * }</pre>
 */
public final class LogicalOperatorFactory {

    /**
     * Creates the descriptor of one operator kind.
     */
    @FunctionalInterface
    public interface OperatorConstructor {
        /**
         * @param lNode the node supplying the left block
         * @param rNode the node supplying the right block
         * @param matching the vector matching
         * @return the operator descriptor
         */
        BaseOp create(NodeId lNode, NodeId rNode, VectorMatching matching);
    }

    private record Registration(OperatorConstructor constructor, ProcessorFactory processorFactory) {
    }

    private static final Map<String, Registration> OPERATORS = Map.of(
        UnlessOp.NAME,
        new Registration(UnlessOp::create, UnlessOp.PROCESSOR_FACTORY)
    );

    private LogicalOperatorFactory() {}

    /**
     * Create an operator descriptor.
     *
     * @param operatorType the operator kind
     * @param lNode the node supplying the left block
     * @param rNode the node supplying the right block
     * @param matching the vector matching
     * @return the operator descriptor
     * @throws IllegalArgumentException if the operator kind is null, empty or unknown
     */
    public static BaseOp create(String operatorType, NodeId lNode, NodeId rNode, VectorMatching matching) {
        return getRegistration(operatorType).constructor().create(lNode, rNode, matching);
    }

    /**
     * Create an operator descriptor from planner arguments.
     *
     * @param operatorType the operator kind
     * @param args map holding {@value BaseOp#LHS_KEY}, {@value BaseOp#RHS_KEY} and optionally
     *             {@value BaseOp#MATCHING_KEY}
     * @return the operator descriptor
     * @throws IllegalArgumentException if the operator kind is unknown or an argument is missing or malformed
     */
    @SuppressWarnings("unchecked")
    public static BaseOp createWithArgs(String operatorType, Map<String, Object> args) {
        OperatorConstructor constructor = getRegistration(operatorType).constructor();
        if (args == null) {
            throw new IllegalArgumentException("Arguments for operator '" + operatorType + "' cannot be null");
        }
        NodeId lNode = readNodeId(operatorType, args, BaseOp.LHS_KEY);
        NodeId rNode = readNodeId(operatorType, args, BaseOp.RHS_KEY);
        Object matching = args.get(BaseOp.MATCHING_KEY);
        if (matching != null && matching instanceof Map == false) {
            throw new IllegalArgumentException(BaseOp.MATCHING_KEY + " must be an object, got: " + matching);
        }
        return constructor.create(lNode, rNode, VectorMatching.fromArgs((Map<String, Object>) matching));
    }

    private static NodeId readNodeId(String operatorType, Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value instanceof String == false || ((String) value).isEmpty()) {
            throw new IllegalArgumentException(operatorType + " operator requires a non-empty " + key + " argument");
        }
        return new NodeId((String) value);
    }

    /**
     * @param operatorType the operator kind
     * @return true if the kind is registered
     */
    public static boolean isOperatorTypeSupported(String operatorType) {
        return operatorType != null && OPERATORS.containsKey(operatorType);
    }

    /**
     * @return the registered operator kinds, sorted
     */
    public static Set<String> getSupportedOperatorTypes() {
        return new TreeSet<>(OPERATORS.keySet());
    }

    /**
     * Get the factory creating processors for an operator kind.
     *
     * @param operatorType the operator kind
     * @return the processor factory
     * @throws IllegalArgumentException if the operator kind is null, empty or unknown
     */
    public static ProcessorFactory getProcessorFactory(String operatorType) {
        return getRegistration(operatorType).processorFactory();
    }

    private static Registration getRegistration(String operatorType) {
        if (operatorType == null || operatorType.isEmpty()) {
            throw new IllegalArgumentException("Operator type cannot be null or empty");
        }
        Registration registration = OPERATORS.get(operatorType);
        if (registration == null) {
            throw new IllegalArgumentException("Unknown operator type: " + operatorType + ". Supported types: " + getSupportedOperatorTypes());
        }
        return registration;
    }
}
