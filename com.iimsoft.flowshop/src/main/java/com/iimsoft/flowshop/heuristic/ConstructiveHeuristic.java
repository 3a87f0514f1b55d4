package com.iimsoft.flowshop.heuristic;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;

/**
 * Builds a complete sequence from scratch. Implementations are stateless with respect
 * to the matrix and always return a permutation of all job indices.
 */
public interface ConstructiveHeuristic {

    HeuristicType type();

    JobSequence construct(ProcessingTimeMatrix matrix);

    /** Whether {@link #construct} accepts this matrix shape. */
    default boolean supports(ProcessingTimeMatrix matrix) {
        return true;
    }
}
