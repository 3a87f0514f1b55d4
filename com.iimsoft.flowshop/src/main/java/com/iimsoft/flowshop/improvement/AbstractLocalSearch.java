package com.iimsoft.flowshop.improvement;

import com.iimsoft.flowshop.domain.CompletionTimeMatrix;
import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.evaluation.MakespanEvaluator;
import com.iimsoft.flowshop.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 邻域局部搜索骨架：
 * - 每次迭代扫描整个邻域（子类给出移动的枚举顺序）
 * - 只接受严格改进；BEST 取改进最大者（并列取扫描顺序最早），FIRST 取第一个改进
 * - 一次扫描无改进即停止，或达到 maxIterations
 *
 * 候选解用 MakespanEvaluator.makespanFrom 评估，复用未变化的前缀行。
 */
public abstract class AbstractLocalSearch implements ImprovementOperator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractLocalSearch.class);

    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    private final int maxIterations;
    private final AcceptancePolicy policy;

    protected AbstractLocalSearch(int maxIterations, AcceptancePolicy policy) {
        if (maxIterations < 1) {
            throw new ConfigurationException(getClass().getSimpleName(), "maxIterations must be >= 1, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public ImprovementResult improve(ProcessingTimeMatrix matrix, JobSequence start) {
        int n = matrix.jobCount();
        start.requirePermutationOf(n, getClass().getSimpleName());
        CompletionTimeMatrix completion = MakespanEvaluator.completionMatrix(start, matrix);
        double makespan = completion.makespan();
        if (n < 2) {
            return new ImprovementResult(start, makespan, 0);
        }

        JobSequence current = start;
        int scans = 0;
        while (scans < maxIterations) {
            scans++;
            Scan scan = new Scan(matrix, current, completion, makespan);
            scanNeighborhood(n, scan);
            if (scan.bestMove == null) {
                break;
            }
            LOGGER.debug("{} scan {}: {} {} -> {}", type().getDisplayName(), scans, scan.bestMove, makespan, scan.bestMakespan);
            current = scan.bestSequence;
            makespan = scan.bestMakespan;
            completion = MakespanEvaluator.completionMatrix(current, matrix);
        }
        return new ImprovementResult(current, makespan, scans);
    }

    /**
     * Offers every move of the neighborhood to {@code scan} in a fixed order and stops
     * as soon as {@link Scan#offer} returns {@code true}.
     */
    protected abstract void scanNeighborhood(int n, Scan scan);

    public int getMaxIterations() {
        return maxIterations;
    }

    public AcceptancePolicy getPolicy() {
        return policy;
    }

    /** One pass over the neighborhood of {@code current}. */
    protected final class Scan {
        private final ProcessingTimeMatrix matrix;
        private final JobSequence current;
        private final CompletionTimeMatrix completion;

        private Move bestMove;
        private JobSequence bestSequence;
        private double bestMakespan;

        private Scan(ProcessingTimeMatrix matrix, JobSequence current, CompletionTimeMatrix completion, double currentMakespan) {
            this.matrix = matrix;
            this.current = current;
            this.completion = completion;
            this.bestMakespan = currentMakespan;
        }

        /** @return whether the scan should stop */
        public boolean offer(Move move) {
            JobSequence candidate = move.applyTo(current);
            double makespan = MakespanEvaluator.makespanFrom(completion, candidate, move.firstChangedPosition(), matrix);
            if (makespan < bestMakespan) {
                bestMove = move;
                bestSequence = candidate;
                bestMakespan = makespan;
                return policy == AcceptancePolicy.FIRST;
            }
            return false;
        }
    }
}
