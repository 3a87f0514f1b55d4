package com.iimsoft.flowshop.improvement;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;

/**
 * Refines an existing sequence. The input is never modified and the returned makespan is
 * never worse than the makespan of {@code start}.
 */
public interface ImprovementOperator {

    ImprovementType type();

    ImprovementResult improve(ProcessingTimeMatrix matrix, JobSequence start);
}
