package com.iimsoft.flowshop.service;

import com.iimsoft.flowshop.FlowShopFixtures;
import com.iimsoft.flowshop.api.dto.SolveRequest;
import com.iimsoft.flowshop.api.dto.SolveResponse;
import com.iimsoft.flowshop.config.SearchConfig;
import com.iimsoft.flowshop.exception.ConfigurationException;
import com.iimsoft.flowshop.exception.DimensionException;
import com.iimsoft.flowshop.exception.DomainException;
import com.iimsoft.flowshop.heuristic.HeuristicType;
import com.iimsoft.flowshop.improvement.ImprovementType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FlowShopSolveServiceTest {

    private final FlowShopSolveService service = new FlowShopSolveService();

    private static SearchConfig fastConfig() {
        SearchConfig config = SearchConfig.defaults();
        config.setRandomSeed(42L);
        config.setVnsMaxIterations(5);
        config.setGaPopulationSize(20);
        config.setGaEliteSize(2);
        config.setGaGenerations(10);
        config.setGaStandaloneGenerations(10);
        return config;
    }

    private static SolveRequest request(double[][] times) {
        SolveRequest request = new SolveRequest();
        request.processingTimes = times;
        request.config = fastConfig();
        return request;
    }

    @Test
    void allHeuristicsRunAndJohnsonIsSkippedOnThreeMachines() {
        SolveResponse resp = service.solve(request(FlowShopFixtures.THREE_BY_THREE));

        List<String> methods = resp.comparison.stream().map(r -> r.method).collect(Collectors.toList());
        assertEquals(7, methods.size());
        assertFalse(methods.contains("Johnson"));
        assertTrue(methods.containsAll(List.of("NEH", "SPT", "LPT", "Palmer", "CDS", "Pendulum", "Random")));

        assertEquals("NEH", resp.bestMethod);
        assertEquals(27.0, resp.bestMakespan);
        assertEquals(List.of(0, 2, 1), resp.bestSequence);
        assertEquals(List.of("Job_1", "Job_3", "Job_2"), resp.bestJobNames);
        assertEquals(2, resp.bottleneckMachine);
        assertArrayEquals(new double[]{11, 13, 10}, resp.machineIdleTimes);
    }

    @Test
    void comparisonIsSortedAscendingWithRunOrderOnTies() {
        SolveResponse resp = service.solve(request(FlowShopFixtures.THREE_BY_THREE));
        for (int i = 1; i < resp.comparison.size(); i++) {
            assertTrue(resp.comparison.get(i).makespan >= resp.comparison.get(i - 1).makespan);
        }
        // NEH and LPT both give [0,2,1] = 27; NEH ran first
        assertEquals("NEH", resp.comparison.get(0).method);
        assertEquals("LPT", resp.comparison.get(1).method);
    }

    @Test
    void johnsonRunsOnTwoMachines() {
        SolveRequest request = request(new double[][]{{3, 6}, {5, 2}, {1, 2}});
        request.heuristics = List.of(HeuristicType.JOHNSON, HeuristicType.SPT);
        SolveResponse resp = service.solve(request);
        assertEquals("Johnson", resp.bestMethod);
        assertEquals(List.of(2, 0, 1), resp.bestSequence);
    }

    @Test
    void improvementsAreSeededWithTheBestHeuristic() {
        SolveRequest request = request(FlowShopFixtures.THREE_BY_THREE);
        request.heuristics = List.of(HeuristicType.SPT, HeuristicType.PALMER);
        request.improvements = List.of(ImprovementType.TWO_OPT, ImprovementType.INSERTION,
                ImprovementType.VNS, ImprovementType.ADJACENT_SWAP, ImprovementType.GENETIC);
        request.standaloneGenetic = true;
        request.jobNames = List.of("A", "B", "C");

        SolveResponse resp = service.solve(request);
        List<String> methods = resp.comparison.stream().map(r -> r.method).collect(Collectors.toList());
        // SPT = [1,0,2] (28), Palmer = [0,1,2] (28): SPT ran first, so it seeds
        assertTrue(methods.containsAll(List.of("SPT + 2-opt", "SPT + Insertion", "SPT + VNS", "SPT + Adjacent swap", "SPT + GA",
                FlowShopSolveService.STANDALONE_GENETIC_METHOD)));
        assertEquals(27.0, resp.bestMakespan);
        assertEquals(List.of("A", "C", "B"), resp.bestJobNames);
        assertTrue(resp.bestMethod.startsWith("SPT + "));
    }

    @Test
    void sameSeedSameResponse() {
        double[][] times = FlowShopFixtures.randomMatrix(new java.util.Random(8), 9, 4).toArray();
        SolveRequest a = request(times);
        a.improvements = List.of(ImprovementType.VNS, ImprovementType.GENETIC);
        SolveRequest b = request(times);
        b.improvements = List.of(ImprovementType.VNS, ImprovementType.GENETIC);

        SolveResponse ra = service.solve(a);
        SolveResponse rb = service.solve(b);
        assertEquals(ra.bestSequence, rb.bestSequence);
        assertEquals(ra.comparison.stream().map(r -> r.sequence).collect(Collectors.toList()),
                rb.comparison.stream().map(r -> r.sequence).collect(Collectors.toList()));
    }

    @Test
    void invalidInputsSurfaceImmediately() {
        assertThrows(IllegalArgumentException.class, () -> service.solve(new SolveRequest()));
        assertThrows(DimensionException.class, () -> service.solve(request(new double[][]{{1, 2}, {3}})));
        assertThrows(DomainException.class, () -> service.solve(request(new double[][]{{1, -2}})));

        SolveRequest wrongNames = request(FlowShopFixtures.THREE_BY_THREE);
        wrongNames.jobNames = List.of("only one");
        assertThrows(IllegalArgumentException.class, () -> service.solve(wrongNames));

        SolveRequest nullHeuristic = request(FlowShopFixtures.THREE_BY_THREE);
        nullHeuristic.heuristics = Arrays.asList(HeuristicType.NEH, null);
        assertThrows(IllegalArgumentException.class, () -> service.solve(nullHeuristic));

        SolveRequest nullImprovement = request(FlowShopFixtures.THREE_BY_THREE);
        nullImprovement.improvements = Arrays.asList(null, ImprovementType.VNS);
        assertThrows(IllegalArgumentException.class, () -> service.solve(nullImprovement));

        SolveRequest badConfig = request(FlowShopFixtures.THREE_BY_THREE);
        badConfig.config.setGaPopulationSize(0);
        assertThrows(ConfigurationException.class, () -> service.solve(badConfig));
    }

    @Test
    void improvementsWithoutAnApplicableHeuristicAreRejected() {
        SolveRequest request = request(FlowShopFixtures.THREE_BY_THREE);
        request.heuristics = List.of(HeuristicType.JOHNSON);
        request.improvements = List.of(ImprovementType.TWO_OPT);
        assertThrows(IllegalArgumentException.class, () -> service.solve(request));
    }
}
