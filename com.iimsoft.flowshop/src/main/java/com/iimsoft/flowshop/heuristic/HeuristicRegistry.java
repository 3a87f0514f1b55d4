package com.iimsoft.flowshop.heuristic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * HeuristicType -> implementation. New heuristics are added by registering another
 * implementation; callers never branch on the type.
 */
public class HeuristicRegistry {

    private final Map<HeuristicType, ConstructiveHeuristic> heuristics = new EnumMap<>(HeuristicType.class);

    public static HeuristicRegistry withDefaults(Random random) {
        JohnsonRule johnsonRule = new JohnsonRule();
        return new HeuristicRegistry()
                .register(new NehHeuristic())
                .register(TotalTimeHeuristic.shortestFirst())
                .register(TotalTimeHeuristic.longestFirst())
                .register(new PalmerHeuristic())
                .register(new CdsHeuristic(johnsonRule))
                .register(johnsonRule)
                .register(new PendulumHeuristic())
                .register(new RandomHeuristic(random));
    }

    public HeuristicRegistry register(ConstructiveHeuristic heuristic) {
        heuristics.put(heuristic.type(), heuristic);
        return this;
    }

    public ConstructiveHeuristic get(HeuristicType type) {
        ConstructiveHeuristic heuristic = heuristics.get(type);
        if (heuristic == null) {
            throw new IllegalArgumentException("no heuristic registered for " + type);
        }
        return heuristic;
    }

    /** Registered heuristics in enum declaration order. */
    public List<ConstructiveHeuristic> all() {
        return Collections.unmodifiableList(new ArrayList<>(heuristics.values()));
    }
}
