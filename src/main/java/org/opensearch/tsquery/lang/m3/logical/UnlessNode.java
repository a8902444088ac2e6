/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.tsquery.query.block.Block;
import org.opensearch.tsquery.query.block.Builder;
import org.opensearch.tsquery.query.block.SeriesMeta;
import org.opensearch.tsquery.query.block.Step;
import org.opensearch.tsquery.query.block.StepIter;
import org.opensearch.tsquery.query.transform.Controller;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Processor for the {@code unless} operation.
 *
 * <p>The output block carries the left block's metadata and only those left series whose signature, under
 * the operator's {@link VectorMatching}, matches no right series. Surviving series keep their relative
 * order and their values are copied unchanged for every step.</p>
 *
 * <p>Evaluation is a single forward pass over the left block; the right block only contributes its series
 * metadata. Any error from the inputs or the controller aborts the evaluation and is rethrown as is.</p>
 */
public class UnlessNode implements Processor {

    private static final Logger logger = LogManager.getLogger(UnlessNode.class);

    private static final int EXCLUDED = -1;

    private final BaseOp op;
    private final Controller controller;
    private final SignatureFunction signatureFunction;

    /**
     * @param op the operator descriptor
     * @param controller the controller supplying output builders
     */
    public UnlessNode(BaseOp op, Controller controller) {
        this.op = op;
        this.controller = controller;
        this.signatureFunction = Signatures.forMatching(op.getMatching());
    }

    @Override
    public Block process(Block lhs, Block rhs) throws IOException {
        StepIter lIter = lhs.stepIter();
        StepIter rIter = rhs.stepIter();

        if (lIter.stepCount() != rIter.stepCount()) {
            throw BlockMismatchException.mismatchedStepCounts(lIter.stepCount(), rIter.stepCount());
        }

        List<SeriesMeta> lSeriesMeta = lIter.seriesMeta();
        int[] lIds = exclusion(lSeriesMeta, rIter.seriesMeta());
        List<SeriesMeta> takenMeta = new ArrayList<>(lIds.length);
        for (int idx : lIds) {
            takenMeta.add(lSeriesMeta.get(idx));
        }

        Builder builder = controller.blockBuilder(lIter.meta(), takenMeta);
        builder.addCols(lIter.stepCount());
        addValuesAtIndices(lIds, lIter, builder);

        logger.debug(
            "Node [{}] {} kept {} of {} left series over {} steps",
            controller.id(),
            op.getOperatorType(),
            lIds.length,
            lSeriesMeta.size(),
            lIter.stepCount()
        );
        return builder.build();
    }

    private static void addValuesAtIndices(int[] indices, StepIter iter, Builder builder) throws IOException {
        for (int column = 0; iter.next(); column++) {
            Step step = iter.current();
            double[] values = step.values();
            for (int idx : indices) {
                builder.appendValue(column, values[idx]);
            }
        }
    }

    /**
     * Indices of the left series whose signature matches no right series, in ascending order.
     *
     * <p>Left series sharing a signature collapse onto the last of them: only the highest index of a
     * signature group can survive.</p>
     *
     * @param lhs the left series metadata
     * @param rhs the right series metadata
     * @return ascending indices into {@code lhs}
     */
    int[] exclusion(List<SeriesMeta> lhs, List<SeriesMeta> rhs) {
        Map<Long, Integer> leftSigs = new HashMap<>(lhs.size());
        for (int idx = 0; idx < lhs.size(); idx++) {
            leftSigs.put(signatureFunction.signature(lhs.get(idx).tags()), idx);
        }

        for (SeriesMeta rs : rhs) {
            leftSigs.replace(signatureFunction.signature(rs.tags()), EXCLUDED);
        }

        int[] uniqueLeft = new int[leftSigs.size()];
        int count = 0;
        for (int idx : leftSigs.values()) {
            if (idx != EXCLUDED) {
                uniqueLeft[count++] = idx;
            }
        }
        // HashMap iteration order is unspecified
        int[] result = Arrays.copyOf(uniqueLeft, count);
        Arrays.sort(result);
        return result;
    }
}
