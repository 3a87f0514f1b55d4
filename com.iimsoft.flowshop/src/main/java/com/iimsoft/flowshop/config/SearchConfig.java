package com.iimsoft.flowshop.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.flowshop.exception.ConfigurationException;
import com.iimsoft.flowshop.improvement.AcceptancePolicy;
import lombok.Data;

import java.util.Random;

/**
 * 搜索参数（由外部 CLI / 请求 JSON 提供）。
 *
 * 配置来源（优先级从高到低）：
 * 1) 请求体里的 config
 * 2) JVM 参数：-Dflowshop.search.config=JSON
 * 3) 默认值（见字段初始化）
 *
 * 所有改进算法在开始搜索前都要先 {@link #validate()}。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchConfig {

    /** JVM 参数 key */
    public static final String SEARCH_CONFIG_JSON_PROPERTY = "flowshop.search.config";

    private static final String COMPONENT = "SearchConfig";

    /** 2-opt / insertion 扫描次数上限 */
    private int maxIterations = 1000;
    private AcceptancePolicy localSearchPolicy = AcceptancePolicy.BEST;

    /** VNS：连续无改进的外循环次数上限 */
    private int vnsMaxIterations = 100;
    /** VNS：外循环总预算 */
    private int vnsMaxCycles = 1000;
    private int vnsPerturbationSize = 2;

    /** 瓶颈相邻交换：轮数上限 */
    private int adjacentSwapMaxIterations = 400;
    /** 每轮尝试的相邻对数量，null 表示全部 */
    private Integer adjacentSwapTopK;
    /** 墙钟预算（毫秒），<= 0 表示不限 */
    private long adjacentSwapTimeBudgetMillis = 30_000L;

    private int gaPopulationSize = 50;
    private double gaMutationRate = 0.1;
    private double gaCrossoverRate = 0.8;
    private int gaEliteSize = 5;
    private int gaTournamentSize = 3;
    /** 以启发式解为种子时的代数 */
    private int gaGenerations = 50;
    /** 纯随机初始种群时的代数 */
    private int gaStandaloneGenerations = 100;
    private boolean gaParallelEvaluation = false;

    /** null 表示不固定种子 */
    private Long randomSeed;

    public static SearchConfig defaults() {
        return new SearchConfig();
    }

    /** Reads {@value #SEARCH_CONFIG_JSON_PROPERTY}, falling back to defaults when it is absent. */
    public static SearchConfig fromSystemProperty() {
        String json = System.getProperty(SEARCH_CONFIG_JSON_PROPERTY);
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            return new ObjectMapper().readValue(json, SearchConfig.class);
        } catch (Exception e) {
            throw new ConfigurationException(COMPONENT, "invalid JSON in -D" + SEARCH_CONFIG_JSON_PROPERTY + ": " + e.getMessage());
        }
    }

    public Random newRandom() {
        return randomSeed == null ? new Random() : new Random(randomSeed);
    }

    public SearchConfig validate() {
        requireAtLeast("maxIterations", maxIterations, 1);
        if (localSearchPolicy == null) {
            throw new ConfigurationException(COMPONENT, "localSearchPolicy must not be null");
        }
        requireAtLeast("vnsMaxIterations", vnsMaxIterations, 1);
        requireAtLeast("vnsMaxCycles", vnsMaxCycles, 1);
        requireAtLeast("vnsPerturbationSize", vnsPerturbationSize, 0);
        requireAtLeast("adjacentSwapMaxIterations", adjacentSwapMaxIterations, 1);
        if (adjacentSwapTopK != null) {
            requireAtLeast("adjacentSwapTopK", adjacentSwapTopK, 1);
        }
        requireAtLeast("gaPopulationSize", gaPopulationSize, 1);
        requireAtLeast("gaEliteSize", gaEliteSize, 0);
        if (gaEliteSize > gaPopulationSize) {
            throw new ConfigurationException(COMPONENT, String.format(
                    "gaEliteSize (%d) must not exceed gaPopulationSize (%d)", gaEliteSize, gaPopulationSize));
        }
        requireAtLeast("gaTournamentSize", gaTournamentSize, 1);
        requireAtLeast("gaGenerations", gaGenerations, 1);
        requireAtLeast("gaStandaloneGenerations", gaStandaloneGenerations, 1);
        requireRate("gaMutationRate", gaMutationRate);
        requireRate("gaCrossoverRate", gaCrossoverRate);
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
