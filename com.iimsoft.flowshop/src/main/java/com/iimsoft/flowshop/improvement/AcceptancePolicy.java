package com.iimsoft.flowshop.improvement;

/** Which improving move a local-search scan adopts. */
public enum AcceptancePolicy {
    /** Scan the whole neighborhood, take the largest improvement (earliest move on ties). */
    BEST,
    /** Take the first strictly improving move in scan order. */
    FIRST
}
