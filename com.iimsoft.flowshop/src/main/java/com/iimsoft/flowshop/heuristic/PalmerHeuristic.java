package com.iimsoft.flowshop.heuristic;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;

/**
 * Palmer slope index: S_j = -Σ_k (m - (2k - 1)) * p[j][k] with k counted from 1,
 * jobs sorted by S_j descending. Jobs whose times grow along the line come first.
 */
public class PalmerHeuristic implements ConstructiveHeuristic {

    @Override
    public HeuristicType type() {
        return HeuristicType.PALMER;
    }

    @Override
    public JobSequence construct(ProcessingTimeMatrix matrix) {
        int n = matrix.jobCount();
        double[] slope = new double[n];
        for (int j = 0; j < n; j++) {
            slope[j] = slopeIndex(matrix, j);
        }
        return JobOrdering.sequenceOf(n, job -> slope[job], true);
    }

    static double slopeIndex(ProcessingTimeMatrix matrix, int job) {
        int m = matrix.machineCount();
        double sum = 0.0;
        for (int k = 1; k <= m; k++) {
            sum += (m - (2 * k - 1)) * matrix.time(job, k - 1);
        }
        return -sum;
    }
}
