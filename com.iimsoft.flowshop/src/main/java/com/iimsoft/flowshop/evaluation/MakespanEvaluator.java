package com.iimsoft.flowshop.evaluation;

import com.iimsoft.flowshop.domain.CompletionTimeMatrix;
import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.exception.DimensionException;

/**
 * 完工时间 / makespan 评估器。
 *
 * 所有启发式与改进算子只调用这里的方法打分，避免各处重复实现递推：
 * - C[0][0] = p[s0][0]
 * - C[i][0] = C[i-1][0] + p[si][0]
 * - C[0][j] = C[0][j-1] + p[s0][j]
 * - C[i][j] = max(C[i-1][j], C[i][j-1]) + p[si][j]
 *
 * 每一行都由 {@link #fillRow} 计算，完整矩阵、单值 makespan 和增量重算因此得到逐位相同的结果。
 */
public final class MakespanEvaluator {

    private static final String COMPONENT = "MakespanEvaluator";

    private MakespanEvaluator() {
    }

    public static CompletionTimeMatrix completionMatrix(JobSequence sequence, ProcessingTimeMatrix matrix) {
        sequence.requirePermutationOf(matrix.jobCount(), COMPONENT);
        int n = sequence.size();
        double[][] c = new double[n][matrix.machineCount()];
        double[] previous = null;
        for (int i = 0; i < n; i++) {
            fillRow(matrix, sequence.jobAt(i), previous, c[i]);
            previous = c[i];
        }
        return new CompletionTimeMatrix(c);
    }

    public static double makespan(JobSequence sequence, ProcessingTimeMatrix matrix) {
        sequence.requirePermutationOf(matrix.jobCount(), COMPONENT);
        return rollForward(matrix, sequence, 0, null);
    }

    /**
     * Makespan of a prefix being built (NEH). Indices must be distinct and in range;
     * not every job has to be present.
     */
    public static double partialMakespan(JobSequence jobs, ProcessingTimeMatrix matrix) {
        int n = matrix.jobCount();
        if (jobs.size() == 0 || jobs.size() > n) {
            throw new DimensionException(COMPONENT, String.format(
                    "partial sequence length %d outside 1..%d", jobs.size(), n));
        }
        boolean[] seen = new boolean[n];
        for (int i = 0; i < jobs.size(); i++) {
            int job = jobs.jobAt(i);
            if (job < 0 || job >= n || seen[job]) {
                throw new DimensionException(COMPONENT, String.format(
                        "partial sequence %s has an invalid or repeated job index %d", jobs, job));
            }
            seen[job] = true;
        }
        return rollForward(matrix, jobs, 0, null);
    }

    /**
     * Re-evaluates {@code candidate} reusing the rows of {@code base} before
     * {@code firstChangedRow}. The caller guarantees that the first {@code firstChangedRow}
     * positions of the candidate equal those of the sequence {@code base} was computed for.
     */
    public static double makespanFrom(CompletionTimeMatrix base, JobSequence candidate,
                                      int firstChangedRow, ProcessingTimeMatrix matrix) {
        candidate.requirePermutationOf(matrix.jobCount(), COMPONENT);
        if (base.rows() != candidate.size() || base.machines() != matrix.machineCount()) {
            throw new DimensionException(COMPONENT, String.format(
                    "base completion matrix is %dx%d, candidate needs %dx%d",
                    base.rows(), base.machines(), candidate.size(), matrix.machineCount()));
        }
        if (firstChangedRow <= 0) {
            return rollForward(matrix, candidate, 0, null);
        }
        if (firstChangedRow >= candidate.size()) {
            return base.makespan();
        }
        int m = matrix.machineCount();
        double[] previous = new double[m];
        for (int j = 0; j < m; j++) {
            previous[j] = base.at(firstChangedRow - 1, j);
        }
        return rollForward(matrix, candidate, firstChangedRow, previous);
    }

    /** idle[j] = makespan − Σ p[·][j]. Reporting only. */
    public static double[] machineIdleTimes(JobSequence sequence, ProcessingTimeMatrix matrix) {
        double makespan = makespan(sequence, matrix);
        double[] idle = new double[matrix.machineCount()];
        for (int j = 0; j < idle.length; j++) {
            idle[j] = makespan - matrix.machineLoad(j);
        }
        return idle;
    }

    /** Per machine, the gaps between finishing one job and starting the next one. */
    public static double[] waitingIdleTimes(JobSequence sequence, ProcessingTimeMatrix matrix) {
        CompletionTimeMatrix c = completionMatrix(sequence, matrix);
        double[] idle = new double[matrix.machineCount()];
        for (int j = 1; j < idle.length; j++) {
            for (int i = 1; i < c.rows(); i++) {
                idle[j] += Math.max(0.0, c.at(i, j - 1) - c.at(i - 1, j));
            }
        }
        return idle;
    }

    /** Machine with the largest total load; lowest index on ties. */
    public static int bottleneckMachine(ProcessingTimeMatrix matrix) {
        int best = 0;
        double bestLoad = matrix.machineLoad(0);
        for (int j = 1; j < matrix.machineCount(); j++) {
            double load = matrix.machineLoad(j);
            if (load > bestLoad) {
                bestLoad = load;
                best = j;
            }
        }
        return best;
    }

    private static double rollForward(ProcessingTimeMatrix matrix, JobSequence jobs, int fromRow, double[] previous) {
        int m = matrix.machineCount();
        double[] prev = previous;
        double[] cur = new double[m];
        double[] spare = new double[m];
        for (int i = fromRow; i < jobs.size(); i++) {
            fillRow(matrix, jobs.jobAt(i), prev, cur);
            prev = cur;
            cur = spare;
            spare = prev;
        }
        return prev[m - 1];
    }

    private static void fillRow(ProcessingTimeMatrix matrix, int job, double[] previous, double[] row) {
        for (int j = 0; j < row.length; j++) {
            double p = matrix.time(job, j);
            if (previous == null) {
                row[j] = (j == 0) ? p : row[j - 1] + p;
            } else {
                row[j] = (j == 0) ? previous[0] + p : Math.max(previous[j], row[j - 1]) + p;
            }
        }
    }
}
