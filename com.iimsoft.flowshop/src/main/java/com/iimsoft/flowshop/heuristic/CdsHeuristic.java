package com.iimsoft.flowshop.heuristic;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.evaluation.MakespanEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Campbell-Dudek-Smith: for every split k in 1..m-1 the line is folded into two virtual
 * machines (first k machines, remaining m-k machines), Johnson's rule orders the jobs, and
 * the real makespan decides. The first split wins ties. With a single machine there is no
 * split and the identity order is returned.
 */
public class CdsHeuristic implements ConstructiveHeuristic {

    private static final Logger LOGGER = LoggerFactory.getLogger(CdsHeuristic.class);

    private final JohnsonRule johnsonRule;

    public CdsHeuristic() {
        this(new JohnsonRule());
    }

    public CdsHeuristic(JohnsonRule johnsonRule) {
        this.johnsonRule = johnsonRule;
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.CDS;
    }

    @Override
    public JobSequence construct(ProcessingTimeMatrix matrix) {
        int m = matrix.machineCount();
        if (m < 2) {
            return JobSequence.identity(matrix.jobCount());
        }
        JobSequence best = null;
        double bestMakespan = Double.POSITIVE_INFINITY;
        for (int k = 1; k < m; k++) {
            JobSequence candidate = johnsonRule.construct(virtualMachines(matrix, k));
            double makespan = MakespanEvaluator.makespan(candidate, matrix);
            LOGGER.debug("CDS split k={} -> {} makespan={}", k, candidate, makespan);
            if (makespan < bestMakespan) {
                bestMakespan = makespan;
                best = candidate;
            }
        }
        return best;
    }

    /** Two-column matrix: [Σ p[job][0..k-1], Σ p[job][k..m-1]]. */
    public static ProcessingTimeMatrix virtualMachines(ProcessingTimeMatrix matrix, int k) {
        int m = matrix.machineCount();
        double[][] virtual = new double[matrix.jobCount()][2];
        for (int j = 0; j < matrix.jobCount(); j++) {
            virtual[j][0] = matrix.sumRange(j, 0, k);
            virtual[j][1] = matrix.sumRange(j, k, m);
        }
        return ProcessingTimeMatrix.of(virtual);
    }
}
