package com.iimsoft.flowshop.improvement;

import com.iimsoft.flowshop.config.SearchConfig;
import com.iimsoft.flowshop.ga.GeneticAlgorithmScheduler;
import com.iimsoft.flowshop.ga.GeneticImprovement;

import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/** ImprovementType -> configured operator. */
public class ImprovementRegistry {

    private final Map<ImprovementType, ImprovementOperator> operators = new EnumMap<>(ImprovementType.class);

    /**
     * Operators built from a validated config. Every randomized operator draws from the
     * same injected {@code random}, so one seed fixes the whole run.
     */
    public static ImprovementRegistry withDefaults(SearchConfig config, Random random) {
        config.validate();
        int maxIterations = config.getMaxIterations();
        AcceptancePolicy policy = config.getLocalSearchPolicy();
        return new ImprovementRegistry()
                .register(new TwoOptSearch(maxIterations, policy))
                .register(new InsertionSearch(maxIterations, policy))
                .register(new VariableNeighborhoodSearch(
                        new TwoOptSearch(maxIterations, policy),
                        new InsertionSearch(maxIterations, policy),
                        config.getVnsMaxIterations(),
                        config.getVnsMaxCycles(),
                        config.getVnsPerturbationSize(),
                        random))
                .register(new BottleneckAdjacentSwapSearch(
                        config.getAdjacentSwapMaxIterations(),
                        config.getAdjacentSwapTopK(),
                        config.getAdjacentSwapTimeBudgetMillis(),
                        policy))
                .register(new GeneticImprovement(
                        new GeneticAlgorithmScheduler(random),
                        GeneticAlgorithmScheduler.GAParams.from(config, true)));
    }

    public ImprovementRegistry register(ImprovementOperator operator) {
        operators.put(operator.type(), operator);
        return this;
    }

    public ImprovementOperator get(ImprovementType type) {
        ImprovementOperator operator = operators.get(type);
        if (operator == null) {
            throw new IllegalArgumentException("no improvement operator registered for " + type);
        }
        return operator;
    }
}
