package com.iimsoft.flowshop.heuristic;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;

import java.util.Objects;
import java.util.Random;

/** Uniform random permutation; the baseline the other heuristics are compared against. */
public class RandomHeuristic implements ConstructiveHeuristic {

    private final Random random;

    public RandomHeuristic(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.RANDOM;
    }

    @Override
    public JobSequence construct(ProcessingTimeMatrix matrix) {
        return JobSequence.random(matrix.jobCount(), random);
    }
}
