package com.iimsoft.flowshop.ga;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;
import com.iimsoft.flowshop.evaluation.MakespanEvaluator;
import org.optaplanner.core.api.score.buildin.simplebigdecimal.SimpleBigDecimalScore;

import java.math.BigDecimal;

/**
 * 个体 = 序列 + 缓存的适应度。
 * 序列不可变，交叉/变异总是产生新个体，因此缓存不会与序列脱节。
 * 适应度 = -makespan（SimpleBigDecimalScore 越大越好）。
 */
final class Individual {

    private final JobSequence sequence;
    private SimpleBigDecimalScore score;
    private double makespan = Double.NaN;

    Individual(JobSequence sequence) {
        this.sequence = sequence;
    }

    void evaluate(ProcessingTimeMatrix matrix) {
        double value = MakespanEvaluator.makespan(sequence, matrix);
        this.makespan = value;
        this.score = SimpleBigDecimalScore.of(BigDecimal.valueOf(-value));
    }

    boolean isEvaluated() {
        return score != null;
    }

    /** Strictly fitter than {@code other}. */
    boolean betterThan(Individual other) {
        return score.compareTo(other.score) > 0;
    }

    JobSequence getSequence() {
        return sequence;
    }

    SimpleBigDecimalScore getScore() {
        return score;
    }

    double getMakespan() {
        return makespan;
    }
}
