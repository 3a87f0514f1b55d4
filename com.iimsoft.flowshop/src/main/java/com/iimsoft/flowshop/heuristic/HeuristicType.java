package com.iimsoft.flowshop.heuristic;

/** Registry key for constructive heuristics; declaration order is the default run order. */
public enum HeuristicType {
    NEH("NEH"),
    SPT("SPT"),
    LPT("LPT"),
    PALMER("Palmer"),
    CDS("CDS"),
    JOHNSON("Johnson"),
    PENDULUM("Pendulum"),
    RANDOM("Random");

    private final String displayName;

    HeuristicType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
