package com.iimsoft.flowshop.improvement;

/** Registry key for improvement operators. */
public enum ImprovementType {
    TWO_OPT("2-opt"),
    INSERTION("Insertion"),
    VNS("VNS"),
    ADJACENT_SWAP("Adjacent swap"),
    GENETIC("GA");

    private final String displayName;

    ImprovementType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
