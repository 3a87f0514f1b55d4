package com.iimsoft.flowshop.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 一次 solve 内的结果汇总，由调用方（FlowShopSolveService）持有，不跨组件共享。
 * 排名：makespan 升序；相同 makespan 按记录先后（List.sort 稳定）。
 */
public class ComparisonAccumulator {

    private final List<MethodResult> results = new ArrayList<>();

    public ComparisonAccumulator record(MethodResult result) {
        results.add(result);
        return this;
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    /** Lowest makespan; the earliest recorded result wins ties. */
    public Optional<MethodResult> best() {
        MethodResult best = null;
        for (MethodResult r : results) {
            if (best == null || r.getMakespan() < best.getMakespan()) {
                best = r;
            }
        }
        return Optional.ofNullable(best);
    }

    public List<MethodResult> table() {
        List<MethodResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparingDouble(MethodResult::getMakespan));
        return sorted;
    }
}
