package com.iimsoft.flowshop.heuristic;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.exception.DimensionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Johnson 规则（仅两台机器，且对两机问题最优）。
 * - A 组：p1 <= p2，按 p1 升序
 * - B 组：p1 > p2，按 p2 降序
 * - 结果 = A + B
 *
 * CDS 把虚拟两机矩阵原样交给它。
 */
public class JohnsonRule implements ConstructiveHeuristic {

    @Override
    public HeuristicType type() {
        return HeuristicType.JOHNSON;
    }

    @Override
    public boolean supports(ProcessingTimeMatrix matrix) {
        return matrix.machineCount() == 2;
    }

    @Override
    public JobSequence construct(ProcessingTimeMatrix matrix) {
        if (!supports(matrix)) {
            throw new DimensionException("JohnsonRule", String.format(
                    "requires exactly 2 machines, got %d", matrix.machineCount()));
        }
        List<Integer> first = new ArrayList<>();
        List<Integer> second = new ArrayList<>();
        for (int j = 0; j < matrix.jobCount(); j++) {
            if (matrix.time(j, 0) <= matrix.time(j, 1)) {
                first.add(j);
            } else {
                second.add(j);
            }
        }
        List<Integer> order = new ArrayList<>(matrix.jobCount());
        order.addAll(JobOrdering.sortJobs(first, job -> matrix.time(job, 0), false));
        order.addAll(JobOrdering.sortJobs(second, job -> matrix.time(job, 1), true));
        return JobSequence.of(order);
    }
}
