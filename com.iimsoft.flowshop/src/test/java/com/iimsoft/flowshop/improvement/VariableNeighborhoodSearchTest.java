package com.iimsoft.flowshop.improvement;

import com.iimsoft.flowshop.FlowShopFixtures;
import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.evaluation.MakespanEvaluator;
import com.iimsoft.flowshop.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class VariableNeighborhoodSearchTest {

    private static VariableNeighborhoodSearch vns(int maxIterations, int maxCycles, int k, long seed) {
        return new VariableNeighborhoodSearch(new TwoOptSearch(), new InsertionSearch(),
                maxIterations, maxCycles, k, new Random(seed));
    }

    @Test
    void reachesTheOptimumOnTheSmallInstance() {
        ProcessingTimeMatrix matrix = FlowShopFixtures.threeByThree();
        ImprovementResult r = vns(5, 50, 2, 1L).improve(matrix, JobSequence.of(1, 2, 0));
        assertEquals(27.0, r.getMakespan());
        assertEquals(JobSequence.of(0, 2, 1), r.getSequence());
    }

    @Test
    void stopsAfterTheNoImprovementLimit() {
        ProcessingTimeMatrix matrix = FlowShopFixtures.threeByThree();
        // the seed is already optimal: every cycle fails, so exactly maxIterations cycles run
        ImprovementResult r = vns(7, 1000, 2, 1L).improve(matrix, JobSequence.of(0, 2, 1));
        assertEquals(7, r.getIterations());
        assertEquals(27.0, r.getMakespan());
    }

    @Test
    void stopsWhenTheCycleBudgetIsExhausted() {
        ProcessingTimeMatrix matrix = FlowShopFixtures.threeByThree();
        ImprovementResult r = vns(100, 3, 2, 1L).improve(matrix, JobSequence.of(0, 2, 1));
        assertEquals(3, r.getIterations());
    }

    @Test
    void neverWorseThanTheSeedForAnyPerturbationSizeOrBudget() {
        Random random = new Random(23);
        for (int trial = 0; trial < 8; trial++) {
            ProcessingTimeMatrix p = FlowShopFixtures.randomMatrix(random, 3 + random.nextInt(8), 2 + random.nextInt(4));
            JobSequence seed = JobSequence.random(p.jobCount(), random);
            double seedMakespan = MakespanEvaluator.makespan(seed, p);
            for (int k = 0; k <= 3; k++) {
                ImprovementResult r = vns(1 + trial % 3, 10, k, trial).improve(p, seed);
                assertTrue(r.getSequence().isPermutationOf(p.jobCount()));
                assertTrue(r.getMakespan() <= seedMakespan);
            }
        }
    }

    @Test
    void sameSeedSameResult() {
        ProcessingTimeMatrix p = FlowShopFixtures.randomMatrix(new Random(31), 12, 4);
        JobSequence seed = JobSequence.identity(12);
        ImprovementResult a = vns(10, 100, 2, 99L).improve(p, seed);
        ImprovementResult b = vns(10, 100, 2, 99L).improve(p, seed);
        assertEquals(a.getSequence(), b.getSequence());
        assertEquals(a.getMakespan(), b.getMakespan());
        assertEquals(a.getIterations(), b.getIterations());
    }

    @Test
    void perturbationKeepsThePermutationAndTheInput() {
        VariableNeighborhoodSearch search = vns(1, 1, 3, 5L);
        JobSequence s = JobSequence.identity(6);
        JobSequence perturbed = search.perturb(s);
        assertTrue(perturbed.isPermutationOf(6));
        assertEquals(JobSequence.identity(6), s);
    }

    @Test
    void outOfRangeLimitsAreConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> vns(0, 10, 2, 1L));
        assertThrows(ConfigurationException.class, () -> vns(5, 0, 2, 1L));
        assertThrows(ConfigurationException.class, () -> vns(5, 10, -1, 1L));
    }
}
