package com.iimsoft.flowshop.heuristic;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;

/** SPT / LPT：按作业总加工时间升序 / 降序排列。 */
public class TotalTimeHeuristic implements ConstructiveHeuristic {

    private final boolean longestFirst;

    private TotalTimeHeuristic(boolean longestFirst) {
        this.longestFirst = longestFirst;
    }

    public static TotalTimeHeuristic shortestFirst() {
        return new TotalTimeHeuristic(false);
    }

    public static TotalTimeHeuristic longestFirst() {
        return new TotalTimeHeuristic(true);
    }

    @Override
    public HeuristicType type() {
        return longestFirst ? HeuristicType.LPT : HeuristicType.SPT;
    }

    @Override
    public JobSequence construct(ProcessingTimeMatrix matrix) {
        return JobOrdering.sequenceOf(matrix.jobCount(), matrix::totalTime, longestFirst);
    }
}
