package com.iimsoft.flowshop.improvement;

/** Remove-and-reinsert neighborhood: every job at i moved to every other position j. */
public class InsertionSearch extends AbstractLocalSearch {

    public InsertionSearch() {
        this(DEFAULT_MAX_ITERATIONS, AcceptancePolicy.BEST);
    }

    public InsertionSearch(int maxIterations, AcceptancePolicy policy) {
        super(maxIterations, policy);
    }

    @Override
    public ImprovementType type() {
        return ImprovementType.INSERTION;
    }

    @Override
    protected void scanNeighborhood(int n, Scan scan) {
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (j != i && scan.offer(Move.insertion(i, j))) {
                    return;
                }
            }
        }
    }
}
