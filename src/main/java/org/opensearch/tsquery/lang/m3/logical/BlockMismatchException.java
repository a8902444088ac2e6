/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tsquery.lang.m3.logical;

import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.tsquery.core.model.Labels;
import org.opensearch.tsquery.query.block.Bounds;

/**
 * Raised when the two input blocks of a binary operation cannot be combined.
 */
public class BlockMismatchException extends OpenSearchException {

    /**
     * The precondition that failed.
     */
    public enum Kind {
        /** The blocks cover different time bounds. Not raised by the logical operators yet. */
        MISMATCHED_BOUNDS,
        /** The blocks have a different number of steps. */
        MISMATCHED_STEP_COUNTS,
        /** The blocks carry tags that cannot be reconciled. Not raised by the logical operators yet. */
        CONFLICTING_TAGS
    }

    private final Kind kind;

    private BlockMismatchException(Kind kind, String msg, Object... args) {
        super(msg, args);
        this.kind = kind;
    }

    /**
     * @param left step count of the left block
     * @param right step count of the right block
     * @return the exception
     */
    public static BlockMismatchException mismatchedStepCounts(int left, int right) {
        return new BlockMismatchException(
            Kind.MISMATCHED_STEP_COUNTS,
            "block step counts are mismatched: left has [{}] steps, right has [{}]",
            left,
            right
        );
    }

    /**
     * @param left bounds of the left block
     * @param right bounds of the right block
     * @return the exception
     */
    public static BlockMismatchException mismatchedBounds(Bounds left, Bounds right) {
        return new BlockMismatchException(Kind.MISMATCHED_BOUNDS, "block bounds are mismatched: left [{}], right [{}]", left, right);
    }

    /**
     * @param left tags of the left block
     * @param right tags of the right block
     * @return the exception
     */
    public static BlockMismatchException conflictingTags(Labels left, Labels right) {
        return new BlockMismatchException(Kind.CONFLICTING_TAGS, "block tags conflict: left [{}], right [{}]", left, right);
    }

    /**
     * @return the precondition that failed
     */
    public Kind getKind() {
        return kind;
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
