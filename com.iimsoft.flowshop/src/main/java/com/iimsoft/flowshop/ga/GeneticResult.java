package com.iimsoft.flowshop.ga;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.improvement.ImprovementResult;

import java.util.List;

/**
 * GA outcome. {@code bestMakespanHistory} holds the best-so-far makespan after the initial
 * population (index 0) and after every generation, so it never increases.
 */
public class GeneticResult extends ImprovementResult {

    private final List<Double> bestMakespanHistory;

    public GeneticResult(JobSequence sequence, double makespan, int generations, List<Double> bestMakespanHistory) {
        super(sequence, makespan, generations);
        this.bestMakespanHistory = List.copyOf(bestMakespanHistory);
    }

    public List<Double> getBestMakespanHistory() {
        return bestMakespanHistory;
    }
}
