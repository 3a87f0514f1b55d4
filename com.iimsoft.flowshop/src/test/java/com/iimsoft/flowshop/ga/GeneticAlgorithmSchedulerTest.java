package com.iimsoft.flowshop.ga;

import com.iimsoft.flowshop.FlowShopFixtures;
import com.iimsoft.flowshop.config.SearchConfig;
import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.evaluation.MakespanEvaluator;
import com.iimsoft.flowshop.exception.ConfigurationException;
import com.iimsoft.flowshop.exception.DimensionException;
import com.iimsoft.flowshop.improvement.ImprovementType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GeneticAlgorithmSchedulerTest {

    private final ProcessingTimeMatrix matrix = FlowShopFixtures.randomMatrix(new Random(42), 10, 5);

    private static GeneticAlgorithmScheduler.GAParams params(int generations) {
        GeneticAlgorithmScheduler.GAParams params = new GeneticAlgorithmScheduler.GAParams();
        params.populationSize = 20;
        params.eliteCount = 2;
        params.generations = generations;
        return params;
    }

    @Test
    void bestSoFarNeverRegresses() {
        GeneticResult r = new GeneticAlgorithmScheduler(new Random(1)).solve(matrix, null, params(40));
        List<Double> history = r.getBestMakespanHistory();
        assertEquals(41, history.size());
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i) <= history.get(i - 1), "generation " + i);
        }
        assertEquals(history.get(history.size() - 1), r.getMakespan());
        assertEquals(40, r.getIterations());
    }

    @Test
    void resultIsAPermutationWithAConsistentMakespan() {
        GeneticResult r = new GeneticAlgorithmScheduler(new Random(2)).solve(matrix, null, params(15));
        assertTrue(r.getSequence().isPermutationOf(10));
        assertEquals(MakespanEvaluator.makespan(r.getSequence(), matrix), r.getMakespan());
    }

    @Test
    void seededRunIsNeverWorseThanItsSeed() {
        JobSequence seed = JobSequence.random(10, new Random(3));
        double seedMakespan = MakespanEvaluator.makespan(seed, matrix);
        GeneticResult r = new GeneticAlgorithmScheduler(new Random(4)).solve(matrix, seed, params(10));
        assertTrue(r.getMakespan() <= seedMakespan);
        assertTrue(r.getBestMakespanHistory().get(0) <= seedMakespan);
    }

    @Test
    void fixedSeedIsReproducibleWithOrWithoutParallelEvaluation() {
        GeneticAlgorithmScheduler.GAParams sequential = params(20);
        GeneticAlgorithmScheduler.GAParams parallel = params(20);
        parallel.parallelEvaluation = true;

        GeneticResult a = new GeneticAlgorithmScheduler(new Random(77)).solve(matrix, null, sequential);
        GeneticResult b = new GeneticAlgorithmScheduler(new Random(77)).solve(matrix, null, parallel);
        assertEquals(a.getSequence(), b.getSequence());
        assertEquals(a.getBestMakespanHistory(), b.getBestMakespanHistory());
    }

    @Test
    void orderCrossoverAlwaysYieldsAPermutation() {
        GeneticAlgorithmScheduler ga = new GeneticAlgorithmScheduler(new Random(5));
        Random random = new Random(6);
        for (int trial = 0; trial < 200; trial++) {
            int n = 1 + random.nextInt(12);
            JobSequence a = JobSequence.random(n, random);
            JobSequence b = JobSequence.random(n, random);
            JobSequence child = ga.orderCrossover(a, b);
            assertTrue(child.isPermutationOf(n), a + " x " + b + " -> " + child);
        }
    }

    @Test
    void orderCrossoverOfIdenticalParentsIsTheParent() {
        GeneticAlgorithmScheduler ga = new GeneticAlgorithmScheduler(new Random(8));
        JobSequence parent = JobSequence.of(4, 2, 0, 3, 1);
        for (int i = 0; i < 20; i++) {
            assertEquals(parent, ga.orderCrossover(parent, parent));
        }
    }

    @Test
    void smallInstanceReachesTheOptimum() {
        ProcessingTimeMatrix small = FlowShopFixtures.threeByThree();
        GeneticResult r = new GeneticAlgorithmScheduler(new Random(9)).solve(small, null, params(10));
        assertEquals(27.0, r.getMakespan());
    }

    @Test
    void invalidSeedIsRejected() {
        GeneticAlgorithmScheduler ga = new GeneticAlgorithmScheduler(new Random(1));
        assertThrows(DimensionException.class, () -> ga.solve(matrix, JobSequence.of(0, 1), params(1)));
    }

    @Test
    void paramsFollowTheConfig() {
        SearchConfig config = SearchConfig.defaults();
        GeneticAlgorithmScheduler.GAParams seeded = GeneticAlgorithmScheduler.GAParams.from(config, true);
        GeneticAlgorithmScheduler.GAParams standalone = GeneticAlgorithmScheduler.GAParams.from(config, false);
        assertEquals(50, seeded.populationSize);
        assertEquals(5, seeded.eliteCount);
        assertEquals(3, seeded.tournamentSize);
        assertEquals(0.8, seeded.crossoverRate);
        assertEquals(0.1, seeded.mutationRate);
        assertEquals(50, seeded.generations);
        assertEquals(100, standalone.generations);
    }

    @Test
    void improvementStageUsesTheIncomingSequenceAsSeed() {
        JobSequence seed = JobSequence.identity(10);
        GeneticImprovement stage = new GeneticImprovement(new GeneticAlgorithmScheduler(new Random(10)), params(5));
        assertEquals(ImprovementType.GENETIC, stage.type());
        GeneticResult r = stage.improve(matrix, seed);
        assertTrue(r.getMakespan() <= MakespanEvaluator.makespan(seed, matrix));
    }

    @Test
    void outOfRangeParamsAreRejectedBeforeSearching() {
        GeneticAlgorithmScheduler ga = new GeneticAlgorithmScheduler(new Random(1));

        GeneticAlgorithmScheduler.GAParams emptyPopulation = params(5);
        emptyPopulation.populationSize = 0;
        emptyPopulation.eliteCount = 0;
        assertThrows(ConfigurationException.class, () -> ga.solve(matrix, null, emptyPopulation));

        GeneticAlgorithmScheduler.GAParams noTournament = params(5);
        noTournament.tournamentSize = 0;
        assertThrows(ConfigurationException.class, () -> ga.solve(matrix, null, noTournament));

        GeneticAlgorithmScheduler.GAParams tooManyElites = params(5);
        tooManyElites.eliteCount = 21;
        assertThrows(ConfigurationException.class, () -> ga.solve(matrix, null, tooManyElites));

        GeneticAlgorithmScheduler.GAParams badRate = params(5);
        badRate.crossoverRate = -0.1;
        assertThrows(ConfigurationException.class, () -> ga.solve(matrix, null, badRate));

        GeneticAlgorithmScheduler.GAParams negativeGenerations = params(-1);
        assertThrows(ConfigurationException.class,
                () -> new GeneticImprovement(ga, negativeGenerations));
    }

    @Test
    void zeroGenerationsReturnsTheInitialBest() {
        GeneticResult r = new GeneticAlgorithmScheduler(new Random(3)).solve(matrix, JobSequence.identity(10), params(0));
        assertEquals(1, r.getBestMakespanHistory().size());
        assertTrue(r.getMakespan() <= MakespanEvaluator.makespan(JobSequence.identity(10), matrix));
    }
}
