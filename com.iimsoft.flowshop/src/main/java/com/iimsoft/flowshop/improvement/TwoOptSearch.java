package com.iimsoft.flowshop.improvement;

/** Pairwise-swap neighborhood: every (i, j) with i < j, scanned row by row. */
public class TwoOptSearch extends AbstractLocalSearch {

    public TwoOptSearch() {
        this(DEFAULT_MAX_ITERATIONS, AcceptancePolicy.BEST);
    }

    public TwoOptSearch(int maxIterations, AcceptancePolicy policy) {
        super(maxIterations, policy);
    }

    @Override
    public ImprovementType type() {
        return ImprovementType.TWO_OPT;
    }

    @Override
    protected void scanNeighborhood(int n, Scan scan) {
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                if (scan.offer(Move.swap(i, j))) {
                    return;
                }
            }
        }
    }
}
