package com.iimsoft.flowshop.ga;

import com.iimsoft.flowshop.config.SearchConfig;
import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * 遗传算法求解器：
 * - 基因 = 作业排列（JobSequence）
 * - 适应度 = -makespan（SimpleBigDecimalScore），按个体缓存
 * - 选择 = 锦标赛
 * - 交叉 = 顺序交叉 OX（保证子代仍是排列）
 * - 变异 = 随机交换两个位置
 * - 替换 = 精英保留 + 子代填满
 *
 * 所有随机数都在调用线程上按固定顺序抽取；并行只用于适应度评估，
 * 因此固定种子下结果与是否并行无关。
 */
public class GeneticAlgorithmScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeneticAlgorithmScheduler.class);

    private static final String COMPONENT = "GeneticAlgorithmScheduler";

    public static class GAParams {
        public int populationSize = 50;
        public int generations = 50;
        public double crossoverRate = 0.8;
        public double mutationRate = 0.1; // 每个子代的变异概率
        public int tournamentSize = 3;
        public boolean parallelEvaluation = false;
        public int eliteCount = 5;   // 精英保留

        /** Parameters from a validated config; {@code seeded} picks the generation count. */
        public static GAParams from(SearchConfig config, boolean seeded) {
            GAParams params = new GAParams();
            params.populationSize = config.getGaPopulationSize();
            params.generations = seeded ? config.getGaGenerations() : config.getGaStandaloneGenerations();
            params.crossoverRate = config.getGaCrossoverRate();
            params.mutationRate = config.getGaMutationRate();
            params.tournamentSize = config.getGaTournamentSize();
            params.parallelEvaluation = config.isGaParallelEvaluation();
            params.eliteCount = config.getGaEliteSize();
            return params;
        }

        public GAParams validate() {
            requireAtLeast("populationSize", populationSize, 1);
            requireAtLeast("generations", generations, 0);
            requireAtLeast("tournamentSize", tournamentSize, 1);
            requireAtLeast("eliteCount", eliteCount, 0);
            if (eliteCount > populationSize) {
                throw new ConfigurationException(COMPONENT, String.format(
                        "eliteCount (%d) must not exceed populationSize (%d)", eliteCount, populationSize));
            }
            requireRate("crossoverRate", crossoverRate);
            requireRate("mutationRate", mutationRate);
            return this;
        }

        private static void requireAtLeast(String name, int value, int min) {
            if (value < min) {
                throw new ConfigurationException(COMPONENT, String.format("%s must be >= %d, got %d", name, min, value));
            }
        }

        private static void requireRate(String name, double value) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new ConfigurationException(COMPONENT, String.format("%s must be within [0, 1], got %s", name, value));
            }
        }
    }

    private final Random rnd;

    public GeneticAlgorithmScheduler(Random random) {
        this.rnd = Objects.requireNonNull(random, "random");
    }

    /**
     * @param seed heuristic solution placed in the initial population, or {@code null} for a
     *             fully random population
     */
    public GeneticResult solve(ProcessingTimeMatrix matrix, JobSequence seed, GAParams params) {
        Objects.requireNonNull(matrix, "matrix");
        Objects.requireNonNull(params, "params").validate();
        int n = matrix.jobCount();
        if (seed != null) {
            seed.requirePermutationOf(n, COMPONENT);
        }

        // 初始种群
        List<Individual> population = new ArrayList<>(params.populationSize);
        if (seed != null) {
            population.add(new Individual(seed));
        }
        while (population.size() < params.populationSize) {
            population.add(new Individual(JobSequence.random(n, rnd)));
        }
        evaluatePopulation(population, matrix, params.parallelEvaluation);

        Individual globalBest = bestOf(population);
        List<Double> history = new ArrayList<>(params.generations + 1);
        history.add(globalBest.getMakespan());

        // 演化
        for (int gen = 1; gen <= params.generations; gen++) {
            population.sort(Comparator.comparing(Individual::getScore).reversed());
            List<Individual> next = new ArrayList<>(params.populationSize);

            // 精英保留（缓存的适应度原样带入下一代）
            int elites = Math.min(params.eliteCount, population.size());
            for (int i = 0; i < elites; i++) {
                next.add(population.get(i));
            }

            // 产生后代
            while (next.size() < params.populationSize) {
                Individual p1 = tournamentSelect(population, params.tournamentSize);
                Individual p2 = tournamentSelect(population, params.tournamentSize);

                JobSequence c1 = p1.getSequence();
                JobSequence c2 = p2.getSequence();
                if (randomDouble() < params.crossoverRate) {
                    c1 = orderCrossover(p1.getSequence(), p2.getSequence());
                    c2 = orderCrossover(p2.getSequence(), p1.getSequence());
                }
                c1 = mutate(c1, params.mutationRate);
                c2 = mutate(c2, params.mutationRate);

                next.add(new Individual(c1));
                if (next.size() < params.populationSize) next.add(new Individual(c2));
            }

            // 评估
            evaluatePopulation(next, matrix, params.parallelEvaluation);

            Individual best = bestOf(next);
            if (best.betterThan(globalBest)) {
                globalBest = best;
            }
            history.add(globalBest.getMakespan());
            LOGGER.debug("GA generation {}: generation best {}, overall best {}", gen, best.getMakespan(), globalBest.getMakespan());

            population = next;
        }

        return new GeneticResult(globalBest.getSequence(), globalBest.getMakespan(), params.generations, history);
    }

    // ============ operators ============

    /**
     * OX：随机取两个切点 [a, b]，子代在相同位置复制 A 的片段，
     * 其余位置从左到右按 B 的相对顺序填入尚未出现的基因。
     */
    JobSequence orderCrossover(JobSequence parentA, JobSequence parentB) {
        int n = parentA.size();
        int a = randomInt(0, n);
        int b = randomInt(0, n);
        if (a > b) {
            int t = a; a = b; b = t;
        }
        int[] child = new int[n];
        boolean[] present = new boolean[n];
        for (int i = a; i <= b; i++) {
            child[i] = parentA.jobAt(i);
            present[child[i]] = true;
        }
        int fill = 0;
        for (int i = 0; i < n; i++) {
            int gene = parentB.jobAt(i);
            if (present[gene]) continue;
            if (fill == a) fill = b + 1;
            child[fill++] = gene;
        }
        return JobSequence.of(child);
    }

    private JobSequence mutate(JobSequence sequence, double mutationRate) {
        if (randomDouble() < mutationRate && sequence.size() > 1) {
            int i = randomInt(0, sequence.size());
            int j = randomInt(0, sequence.size());
            return sequence.swap(i, j);
        }
        return sequence;
    }

    private Individual tournamentSelect(List<Individual> pop, int k) {
        int n = pop.size();
        Individual best = null;
        for (int i = 0; i < k; i++) {
            Individual candidate = pop.get(randomInt(0, n));
            if (best == null || candidate.betterThan(best)) {
                best = candidate;
            }
        }
        return best;
    }

    private static Individual bestOf(List<Individual> pop) {
        Individual best = pop.get(0);
        for (Individual individual : pop) {
            if (individual.betterThan(best)) {
                best = individual;
            }
        }
        return best;
    }

    private static void evaluatePopulation(List<Individual> pop, ProcessingTimeMatrix matrix, boolean parallel) {
        if (parallel) {
            pop.parallelStream().filter(g -> !g.isEvaluated()).forEach(g -> g.evaluate(matrix));
        } else {
            pop.stream().filter(g -> !g.isEvaluated()).forEach(g -> g.evaluate(matrix));
        }
    }

    // ============ RNG helpers ============

    private int randomInt(int inclusive, int exclusive) {
        return inclusive + rnd.nextInt(exclusive - inclusive);
    }

    private double randomDouble() {
        return rnd.nextDouble();
    }
}
