package com.iimsoft.flowshop.improvement;

import com.iimsoft.flowshop.domain.CompletionTimeMatrix;
import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.evaluation.MakespanEvaluator;
import com.iimsoft.flowshop.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 瓶颈感知的相邻交换局部搜索：
 * 1) 每轮用 {@link AdjacentPairScorer} 给所有相邻对打分，只尝试得分前 topK 的位置
 * 2) 强化：在这些位置上反复接受严格改进的相邻交换（BEST / FIRST），每次接受后重新打分
 * 3) 连续两轮无改进：对得分最高的位置做一次引导扰动，变差不超过 0.2% 才接受；
 *    扰动被拒时，对得分前 10 的位置做 ±14 窗口内的插入，遇到第一个改进即接受
 * 4) 本轮有改进：在得分最高位置 ±18 的窗口内反复做相邻交换直到无改进
 *
 * 终止：maxIterations 轮或时间预算用完。返回见过的最优解，不会比起点差。
 */
public class BottleneckAdjacentSwapSearch implements ImprovementOperator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BottleneckAdjacentSwapSearch.class);

    private static final String COMPONENT = "BottleneckAdjacentSwapSearch";

    public static final int DEFAULT_MAX_ITERATIONS = 400;
    public static final long DEFAULT_TIME_BUDGET_MILLIS = 30_000L;

    static final int PERTURBATION_STREAK = 2;
    static final double MAX_PERTURBATION_WORSENING = 0.002;
    static final int INSERTION_CANDIDATES = 10;
    static final int INSERTION_WINDOW = 14;
    static final int FOCUS_WINDOW = 18;

    private final int maxIterations;
    private final Integer topK;
    private final long timeBudgetMillis;
    private final AcceptancePolicy policy;

    public BottleneckAdjacentSwapSearch() {
        this(DEFAULT_MAX_ITERATIONS, null, DEFAULT_TIME_BUDGET_MILLIS, AcceptancePolicy.BEST);
    }

    /**
     * @param topK             pairs tried per round, {@code null} for all of them
     * @param timeBudgetMillis wall-clock budget; {@code <= 0} disables it
     */
    public BottleneckAdjacentSwapSearch(int maxIterations, Integer topK, long timeBudgetMillis, AcceptancePolicy policy) {
        if (maxIterations < 1) {
            throw new ConfigurationException(COMPONENT, "maxIterations must be >= 1, got " + maxIterations);
        }
        if (topK != null && topK < 1) {
            throw new ConfigurationException(COMPONENT, "topK must be >= 1 when set, got " + topK);
        }
        this.maxIterations = maxIterations;
        this.topK = topK;
        this.timeBudgetMillis = timeBudgetMillis;
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public ImprovementType type() {
        return ImprovementType.ADJACENT_SWAP;
    }

    @Override
    public ImprovementResult improve(ProcessingTimeMatrix matrix, JobSequence start) {
        int n = matrix.jobCount();
        start.requirePermutationOf(n, COMPONENT);
        if (n < 2) {
            return new ImprovementResult(start, MakespanEvaluator.makespan(start, matrix), 0);
        }

        AdjacentPairScorer scorer = new AdjacentPairScorer(matrix, MakespanEvaluator.bottleneckMachine(matrix));
        int k = topK == null ? n - 1 : Math.min(topK, n - 1);
        long deadline = timeBudgetMillis > 0 ? System.currentTimeMillis() + timeBudgetMillis : Long.MAX_VALUE;

        Trajectory t = new Trajectory(matrix, start);
        int iterations = 0;
        int streak = 0;
        while (iterations < maxIterations && System.currentTimeMillis() < deadline) {
            iterations++;
            boolean improved = false;

            List<Integer> ranked = scorer.rank(t.current);
            while (System.currentTimeMillis() < deadline) {
                int pos = improvingSwap(t, ranked.subList(0, k));
                if (pos < 0) {
                    break;
                }
                t.accept(t.current.swap(pos, pos + 1));
                improved = true;
                ranked = scorer.rank(t.current);
            }

            if (improved) {
                streak = 0;
            } else if (++streak >= PERTURBATION_STREAK && perturb(t, ranked.get(0))) {
                streak = 0;
            }

            if (!improved && streak >= PERTURBATION_STREAK
                    && windowedInsertion(t, ranked.subList(0, Math.min(INSERTION_CANDIDATES, k)), n)) {
                improved = true;
                streak = 0;
            }

            if (improved) {
                intensifyAround(t, scorer.rank(t.current).get(0), n);
            }
        }
        if (iterations < maxIterations) {
            LOGGER.warn("{} stopped by its {} ms time budget after {} iterations", COMPONENT, timeBudgetMillis, iterations);
        }
        return new ImprovementResult(t.best, t.bestMakespan, iterations);
    }

    /** Position of the accepted improving swap among {@code positions}, or -1. */
    private int improvingSwap(Trajectory t, List<Integer> positions) {
        int bestPos = -1;
        double bestMakespan = t.makespan;
        for (int pos : positions) {
            double makespan = t.evaluate(t.current.swap(pos, pos + 1), pos);
            if (makespan < bestMakespan) {
                bestPos = pos;
                bestMakespan = makespan;
                if (policy == AcceptancePolicy.FIRST) {
                    break;
                }
            }
        }
        return bestPos;
    }

    /** Applies the swap at {@code pos} even when it is not improving, within the worsening guard. */
    private boolean perturb(Trajectory t, int pos) {
        JobSequence candidate = t.current.swap(pos, pos + 1);
        double makespan = t.evaluate(candidate, pos);
        if (makespan > t.makespan * (1.0 + MAX_PERTURBATION_WORSENING)) {
            LOGGER.debug("Perturbation at {} rejected: {} -> {}", pos, t.makespan, makespan);
            return false;
        }
        LOGGER.debug("Perturbation at {}: {} -> {}", pos, t.makespan, makespan);
        t.accept(candidate);
        return true;
    }

    private boolean windowedInsertion(Trajectory t, List<Integer> positions, int n) {
        for (int pos : positions) {
            int left = Math.max(0, pos - INSERTION_WINDOW);
            int right = Math.min(n - 1, pos + INSERTION_WINDOW);
            for (int target = left; target <= right; target++) {
                if (target == pos) {
                    continue;
                }
                JobSequence candidate = t.current.move(pos, target);
                if (t.evaluate(candidate, Math.min(pos, target)) < t.makespan) {
                    t.accept(candidate);
                    return true;
                }
            }
        }
        return false;
    }

    private void intensifyAround(Trajectory t, int focus, int n) {
        int left = Math.max(0, focus - FOCUS_WINDOW);
        int right = Math.min(n - 2, focus + FOCUS_WINDOW);
        boolean improved = true;
        while (improved) {
            improved = false;
            for (int pos = left; pos <= right; pos++) {
                JobSequence candidate = t.current.swap(pos, pos + 1);
                if (t.evaluate(candidate, pos) < t.makespan) {
                    t.accept(candidate);
                    improved = true;
                }
            }
        }
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public AcceptancePolicy getPolicy() {
        return policy;
    }

    /** Current point of the walk (may be worse than the best after a perturbation) and the best seen. */
    private static final class Trajectory {
        private final ProcessingTimeMatrix matrix;
        private JobSequence current;
        private CompletionTimeMatrix completion;
        private double makespan;
        private JobSequence best;
        private double bestMakespan;

        private Trajectory(ProcessingTimeMatrix matrix, JobSequence start) {
            this.matrix = matrix;
            this.current = start;
            this.completion = MakespanEvaluator.completionMatrix(start, matrix);
            this.makespan = completion.makespan();
            this.best = start;
            this.bestMakespan = makespan;
        }

        private double evaluate(JobSequence candidate, int firstChangedPosition) {
            return MakespanEvaluator.makespanFrom(completion, candidate, firstChangedPosition, matrix);
        }

        private void accept(JobSequence next) {
            current = next;
            completion = MakespanEvaluator.completionMatrix(next, matrix);
            makespan = completion.makespan();
            if (makespan < bestMakespan) {
                best = next;
                bestMakespan = makespan;
            }
        }
    }
}
