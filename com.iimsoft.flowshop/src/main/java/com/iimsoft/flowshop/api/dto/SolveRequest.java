package com.iimsoft.flowshop.api.dto;

import com.iimsoft.flowshop.config.SearchConfig;
import com.iimsoft.flowshop.heuristic.HeuristicType;
import com.iimsoft.flowshop.improvement.ImprovementType;

import java.util.List;

public class SolveRequest {

    /** processingTimes[job][machine] */
    public double[][] processingTimes;

    /** 可选：作业显示名，仅用于输出；默认 Job_1..Job_n */
    public List<String> jobNames;

    /** 可选：要运行的构造启发式；为空时运行全部适用的启发式 */
    public List<HeuristicType> heuristics;

    /** 可选：以最优启发式解为种子依次运行的改进算法 */
    public List<ImprovementType> improvements;

    /** 是否额外运行一次纯随机初始种群的遗传算法 */
    public boolean standaloneGenetic;

    /** 可选：搜索参数；为空时读取 -Dflowshop.search.config 或默认值 */
    public SearchConfig config;
}
