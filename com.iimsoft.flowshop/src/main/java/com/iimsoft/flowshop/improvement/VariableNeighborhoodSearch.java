package com.iimsoft.flowshop.improvement;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.evaluation.MakespanEvaluator;
import com.iimsoft.flowshop.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * 变邻域搜索（VNS）状态机：
 * EXPLOIT_TWO_OPT -> EXPLOIT_INSERTION -> (改进: 回到 EXPLOIT_TWO_OPT | 无改进: PERTURB -> EXPLOIT_TWO_OPT) ... -> DONE
 *
 * - 扰动：对当前最优解做 k 次随机交换（位置互不相同），随机源由调用方注入
 * - 终止：连续 maxIterations 个外循环无改进，或外循环总数达到 maxCycles
 * - 返回值永远是见过的最优解，不会比种子差
 */
public class VariableNeighborhoodSearch implements ImprovementOperator {

    private static final Logger LOGGER = LoggerFactory.getLogger(VariableNeighborhoodSearch.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final int DEFAULT_MAX_CYCLES = 1000;
    public static final int DEFAULT_PERTURBATION_SIZE = 2;

    enum State { EXPLOIT_TWO_OPT, EXPLOIT_INSERTION, PERTURB, DONE }

    private final AbstractLocalSearch twoOpt;
    private final AbstractLocalSearch insertion;
    private final int maxIterations;
    private final int maxCycles;
    private final int perturbationSize;
    private final Random random;

    public VariableNeighborhoodSearch(Random random) {
        this(new TwoOptSearch(), new InsertionSearch(),
                DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_CYCLES, DEFAULT_PERTURBATION_SIZE, random);
    }

    public VariableNeighborhoodSearch(AbstractLocalSearch twoOpt, AbstractLocalSearch insertion,
                                      int maxIterations, int maxCycles, int perturbationSize, Random random) {
        this.twoOpt = Objects.requireNonNull(twoOpt, "twoOpt");
        this.insertion = Objects.requireNonNull(insertion, "insertion");
        if (maxIterations < 1 || maxCycles < 1 || perturbationSize < 0) {
            throw new ConfigurationException("VariableNeighborhoodSearch", String.format(
                    "need maxIterations >= 1, maxCycles >= 1, perturbationSize >= 0; got %d, %d, %d",
                    maxIterations, maxCycles, perturbationSize));
        }
        this.maxIterations = maxIterations;
        this.maxCycles = maxCycles;
        this.perturbationSize = perturbationSize;
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public ImprovementType type() {
        return ImprovementType.VNS;
    }

    @Override
    public ImprovementResult improve(ProcessingTimeMatrix matrix, JobSequence start) {
        start.requirePermutationOf(matrix.jobCount(), "VariableNeighborhoodSearch");
        JobSequence best = start;
        double bestMakespan = MakespanEvaluator.makespan(start, matrix);
        if (matrix.jobCount() < 2) {
            return new ImprovementResult(best, bestMakespan, 0);
        }

        JobSequence current = start;
        JobSequence localOptimum = start;
        int cycles = 0;
        int sinceImprovement = 0;
        State state = State.EXPLOIT_TWO_OPT;
        while (state != State.DONE) {
            switch (state) {
                case EXPLOIT_TWO_OPT:
                    cycles++;
                    localOptimum = twoOpt.improve(matrix, current).getSequence();
                    state = State.EXPLOIT_INSERTION;
                    break;
                case EXPLOIT_INSERTION:
                    ImprovementResult result = insertion.improve(matrix, localOptimum);
                    if (result.getMakespan() < bestMakespan) {
                        LOGGER.debug("VNS cycle {}: {} -> {}", cycles, bestMakespan, result.getMakespan());
                        best = result.getSequence();
                        bestMakespan = result.getMakespan();
                        current = best;
                        sinceImprovement = 0;
                        state = State.EXPLOIT_TWO_OPT;
                    } else {
                        sinceImprovement++;
                        state = State.PERTURB;
                    }
                    if (sinceImprovement >= maxIterations || cycles >= maxCycles) {
                        state = State.DONE;
                    }
                    break;
                case PERTURB:
                    current = perturb(best);
                    state = State.EXPLOIT_TWO_OPT;
                    break;
                default:
                    throw new IllegalStateException("Unexpected VNS state: " + state);
            }
        }
        LOGGER.debug("VNS finished after {} cycles, best makespan {}", cycles, bestMakespan);
        return new ImprovementResult(best, bestMakespan, cycles);
    }

    /** k random swaps of two distinct positions applied to a copy of {@code sequence}. */
    JobSequence perturb(JobSequence sequence) {
        int n = sequence.size();
        JobSequence perturbed = sequence;
        for (int s = 0; s < perturbationSize; s++) {
            int i = random.nextInt(n);
            int j = random.nextInt(n - 1);
            if (j >= i) {
                j++;
            }
            perturbed = perturbed.swap(i, j);
        }
        return perturbed;
    }
}
