package com.iimsoft.flowshop.ga;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.improvement.ImprovementOperator;
import com.iimsoft.flowshop.improvement.ImprovementType;

import java.util.Objects;

/** The GA as an improvement stage: the incoming sequence seeds the initial population. */
public class GeneticImprovement implements ImprovementOperator {

    private final GeneticAlgorithmScheduler scheduler;
    private final GeneticAlgorithmScheduler.GAParams params;

    public GeneticImprovement(GeneticAlgorithmScheduler scheduler, GeneticAlgorithmScheduler.GAParams params) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.params = Objects.requireNonNull(params, "params").validate();
    }

    @Override
    public ImprovementType type() {
        return ImprovementType.GENETIC;
    }

    @Override
    public GeneticResult improve(ProcessingTimeMatrix matrix, JobSequence start) {
        Objects.requireNonNull(start, "start");
        return scheduler.solve(matrix, start, params);
    }
}
