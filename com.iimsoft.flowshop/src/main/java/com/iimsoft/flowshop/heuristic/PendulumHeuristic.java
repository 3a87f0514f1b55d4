package com.iimsoft.flowshop.heuristic;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;

import java.util.List;

/**
 * 钟摆启发式：轻作业放两端、重作业放中间（“轻-重-轻”）。
 * 作业按总时间升序，第 i 个（i 从 0 开始）偶数放前游标、奇数放后游标，两个游标向中间推进。
 */
public class PendulumHeuristic implements ConstructiveHeuristic {

    @Override
    public HeuristicType type() {
        return HeuristicType.PENDULUM;
    }

    @Override
    public JobSequence construct(ProcessingTimeMatrix matrix) {
        int n = matrix.jobCount();
        List<Integer> ascending = JobOrdering.sortAllJobs(n, matrix::totalTime, false);
        int[] sequence = new int[n];
        int front = 0;
        int back = n - 1;
        for (int i = 0; i < n; i++) {
            if (i % 2 == 0) {
                sequence[front++] = ascending.get(i);
            } else {
                sequence[back--] = ascending.get(i);
            }
        }
        return JobSequence.of(sequence);
    }
}
