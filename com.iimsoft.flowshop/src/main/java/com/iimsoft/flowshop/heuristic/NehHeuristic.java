package com.iimsoft.flowshop.heuristic;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.evaluation.MakespanEvaluator;

import java.util.List;

/**
 * NEH（Nawaz-Enscore-Ham）：
 * 1) 作业按总加工时间降序（稳定排序）
 * 2) 依次把每个作业插入当前部分序列的所有位置，取部分 makespan 最小的位置（并列取最靠前）
 */
public class NehHeuristic implements ConstructiveHeuristic {

    @Override
    public HeuristicType type() {
        return HeuristicType.NEH;
    }

    @Override
    public JobSequence construct(ProcessingTimeMatrix matrix) {
        List<Integer> order = insertionOrder(matrix);
        JobSequence partial = JobSequence.of(order.get(0));
        for (int idx = 1; idx < order.size(); idx++) {
            int job = order.get(idx);
            JobSequence best = null;
            double bestMakespan = Double.POSITIVE_INFINITY;
            for (int pos = 0; pos <= partial.size(); pos++) {
                JobSequence candidate = partial.insert(pos, job);
                double makespan = MakespanEvaluator.partialMakespan(candidate, matrix);
                if (makespan < bestMakespan) {
                    bestMakespan = makespan;
                    best = candidate;
                }
            }
            partial = best;
        }
        return partial;
    }

    /** Job order NEH inserts in: total processing time descending, index order on ties. */
    public static List<Integer> insertionOrder(ProcessingTimeMatrix matrix) {
        return JobOrdering.sortAllJobs(matrix.jobCount(), matrix::totalTime, true);
    }
}
