package com.iimsoft.flowshop.service;

import com.iimsoft.flowshop.api.dto.SolveRequest;
import com.iimsoft.flowshop.api.dto.SolveResponse;
import com.iimsoft.flowshop.config.SearchConfig;
import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.evaluation.MakespanEvaluator;
import com.iimsoft.flowshop.ga.GeneticAlgorithmScheduler;
import com.iimsoft.flowshop.ga.GeneticResult;
import com.iimsoft.flowshop.heuristic.ConstructiveHeuristic;
import com.iimsoft.flowshop.heuristic.HeuristicRegistry;
import com.iimsoft.flowshop.heuristic.HeuristicType;
import com.iimsoft.flowshop.improvement.ImprovementRegistry;
import com.iimsoft.flowshop.improvement.ImprovementResult;
import com.iimsoft.flowshop.improvement.ImprovementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * 求解入口（驱动层）：
 * 1) 校验请求、构建加工时间矩阵
 * 2) 运行构造启发式
 * 3) 以最优启发式解为种子运行改进算法（可选：再跑一次纯随机初始种群的 GA）
 * 4) 汇总为对比表并组装 response
 */
public class FlowShopSolveService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlowShopSolveService.class);

    public static final String STANDALONE_GENETIC_METHOD = "GA (standalone)";

    public SolveResponse solve(SolveRequest request) {
        Objects.requireNonNull(request, "request");
        validateRequest(request);

        ProcessingTimeMatrix matrix = ProcessingTimeMatrix.of(request.processingTimes);
        List<String> jobNames = resolveJobNames(request, matrix.jobCount());

        // 参数在任何搜索开始前校验
        SearchConfig config = request.config != null ? request.config : SearchConfig.fromSystemProperty();
        config.validate();
        Random random = config.newRandom();
        HeuristicRegistry heuristics = HeuristicRegistry.withDefaults(random);
        ImprovementRegistry improvements = ImprovementRegistry.withDefaults(config, random);

        LOGGER.info("Solving flow shop: {} jobs x {} machines", matrix.jobCount(), matrix.machineCount());
        ComparisonAccumulator accumulator = new ComparisonAccumulator();

        // 1) 构造启发式
        List<HeuristicType> heuristicTypes = request.heuristics == null || request.heuristics.isEmpty()
                ? Arrays.asList(HeuristicType.values())
                : request.heuristics;
        for (HeuristicType type : heuristicTypes) {
            ConstructiveHeuristic heuristic = heuristics.get(type);
            if (!heuristic.supports(matrix)) {
                LOGGER.warn("Skipping {}: not applicable to {} machines", type.getDisplayName(), matrix.machineCount());
                continue;
            }
            long start = System.currentTimeMillis();
            JobSequence sequence = heuristic.construct(matrix);
            double makespan = MakespanEvaluator.makespan(sequence, matrix);
            LOGGER.info("{} -> makespan {} in {} ms", type.getDisplayName(), makespan, System.currentTimeMillis() - start);
            accumulator.record(new MethodResult(type.getDisplayName(), sequence, makespan, 0));
        }

        // 2) 改进算法，种子 = 当前最优启发式解
        List<ImprovementType> improvementTypes = request.improvements == null ? List.of() : request.improvements;
        if (!improvementTypes.isEmpty()) {
            MethodResult seed = accumulator.best().orElseThrow(() -> new IllegalArgumentException(
                    "no applicable heuristic produced a seed for improvements " + improvementTypes));
            for (ImprovementType type : improvementTypes) {
                long start = System.currentTimeMillis();
                ImprovementResult result = improvements.get(type).improve(matrix, seed.getSequence());
                String method = seed.getMethod() + " + " + type.getDisplayName();
                LOGGER.info("{} -> makespan {} ({} iterations) in {} ms",
                        method, result.getMakespan(), result.getIterations(), System.currentTimeMillis() - start);
                accumulator.record(new MethodResult(method, result.getSequence(), result.getMakespan(), result.getIterations()));
            }
        }

        if (request.standaloneGenetic) {
            GeneticResult result = new GeneticAlgorithmScheduler(random)
                    .solve(matrix, null, GeneticAlgorithmScheduler.GAParams.from(config, false));
            LOGGER.info("{} -> makespan {} ({} generations)", STANDALONE_GENETIC_METHOD, result.getMakespan(), result.getIterations());
            accumulator.record(new MethodResult(STANDALONE_GENETIC_METHOD, result.getSequence(), result.getMakespan(), result.getIterations()));
        }

        if (accumulator.isEmpty()) {
            throw new IllegalArgumentException("no requested method is applicable to a "
                    + matrix.jobCount() + "x" + matrix.machineCount() + " instance");
        }
        return buildResponse(matrix, jobNames, accumulator);
    }

    private static void validateRequest(SolveRequest request) {
        if (request.processingTimes == null) {
            throw new IllegalArgumentException("request.processingTimes 不能为空");
        }
        if (request.jobNames != null && request.jobNames.size() != request.processingTimes.length) {
            throw new IllegalArgumentException(String.format(
                    "request.jobNames 长度 (%d) 与作业数 (%d) 不一致",
                    request.jobNames.size(), request.processingTimes.length));
        }
        if (request.heuristics != null && request.heuristics.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("request.heuristics 含有空值");
        }
        if (request.improvements != null && request.improvements.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("request.improvements 含有空值");
        }
    }

    private static List<String> resolveJobNames(SolveRequest request, int n) {
        if (request.jobNames != null) {
            return request.jobNames;
        }
        List<String> names = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            names.add("Job_" + (i + 1));
        }
        return names;
    }

    private SolveResponse buildResponse(ProcessingTimeMatrix matrix, List<String> jobNames, ComparisonAccumulator accumulator) {
        MethodResult best = accumulator.best().orElseThrow();
        LOGGER.info("Best: {} makespan {}", best.getMethod(), best.getMakespan());

        SolveResponse resp = new SolveResponse();
        resp.bestMethod = best.getMethod();
        resp.bestSequence = best.getSequence().toList();
        resp.bestJobNames = namesOf(best.getSequence(), jobNames);
        resp.bestMakespan = best.getMakespan();
        resp.machineIdleTimes = MakespanEvaluator.machineIdleTimes(best.getSequence(), matrix);
        resp.waitingIdleTimes = MakespanEvaluator.waitingIdleTimes(best.getSequence(), matrix);
        resp.bottleneckMachine = MakespanEvaluator.bottleneckMachine(matrix);

        List<SolveResponse.MethodRow> rows = new ArrayList<>();
        for (MethodResult r : accumulator.table()) {
            SolveResponse.MethodRow row = new SolveResponse.MethodRow();
            row.method = r.getMethod();
            row.makespan = r.getMakespan();
            row.sequence = r.getSequence().toList();
            row.jobNames = namesOf(r.getSequence(), jobNames);
            row.iterations = r.getIterations();
            rows.add(row);
        }
        resp.comparison = rows;
        return resp;
    }

    private static List<String> namesOf(JobSequence sequence, List<String> jobNames) {
        List<String> names = new ArrayList<>(sequence.size());
        for (int i = 0; i < sequence.size(); i++) {
            names.add(jobNames.get(sequence.jobAt(i)));
        }
        return names;
    }
}
