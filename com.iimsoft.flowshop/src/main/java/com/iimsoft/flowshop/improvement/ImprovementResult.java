package com.iimsoft.flowshop.improvement;

import com.iimsoft.flowshop.domain.JobSequence;

/**
 * Outcome of an improvement run. {@code iterations} counts neighborhood scans for local
 * search, outer cycles for VNS and generations for the genetic algorithm.
 */
public class ImprovementResult {

    private final JobSequence sequence;
    private final double makespan;
    private final int iterations;

    public ImprovementResult(JobSequence sequence, double makespan, int iterations) {
        this.sequence = sequence;
        this.makespan = makespan;
        this.iterations = iterations;
    }

    public JobSequence getSequence() {
        return sequence;
    }

    public double getMakespan() {
        return makespan;
    }

    public int getIterations() {
        return iterations;
    }

    @Override
    public String toString() {
        return "ImprovementResult{sequence=" + sequence + ", makespan=" + makespan + ", iterations=" + iterations + "}";
    }
}
