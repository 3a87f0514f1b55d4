package com.iimsoft.flowshop.improvement;

import com.iimsoft.flowshop.domain.JobSequence;
import com.iimsoft.flowshop.domain.ProcessingTimeMatrix;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 相邻对 (pos, pos+1) 的交换优先级，分数越高越先尝试：
 * - 两个作业在瓶颈机器上的加工时间差 + 总负荷差
 * - 摆锤偏好：较重的作业靠近中间、较轻的作业靠近两端
 * - 平滑度：交换后 pos-1..pos+2 范围内相邻总负荷差之和下降的部分
 * - 任一作业的瓶颈加工时间位于 80 分位以上时加分
 */
final class AdjacentPairScorer {

    static final double CENTRALITY_WEIGHT = 9.0;
    static final double END_BIAS_WEIGHT = 4.0;
    static final double SMOOTHNESS_WEIGHT = 1.5;
    static final double CRITICAL_BONUS = 5.0;
    static final double CRITICAL_PERCENTILE = 0.8;

    private final ProcessingTimeMatrix matrix;
    private final int bottleneck;
    private final double[] jobTotals;
    private final double criticalThreshold;

    AdjacentPairScorer(ProcessingTimeMatrix matrix, int bottleneck) {
        this.matrix = matrix;
        this.bottleneck = bottleneck;
        int n = matrix.jobCount();
        this.jobTotals = new double[n];
        double[] bottleneckTimes = new double[n];
        for (int j = 0; j < n; j++) {
            jobTotals[j] = matrix.totalTime(j);
            bottleneckTimes[j] = matrix.time(j, bottleneck);
        }
        Arrays.sort(bottleneckTimes);
        int q = Math.max(0, Math.min(n - 1, (int) (CRITICAL_PERCENTILE * (n - 1))));
        this.criticalThreshold = bottleneckTimes[q];
    }

    double score(JobSequence sequence, int pos) {
        int n = sequence.size();
        int a = sequence.jobAt(pos);
        int b = sequence.jobAt(pos + 1);

        double bottleneckDiff = Math.abs(matrix.time(a, bottleneck) - matrix.time(b, bottleneck));
        double totalDiff = Math.abs(jobTotals[a] - jobTotals[b]);

        // 交换后两个作业互换位置；并列时 pos 上的作业算较重
        double center = (n - 1) / 2.0;
        int heavyBefore = jobTotals[a] >= jobTotals[b] ? pos : pos + 1;
        int lightBefore = heavyBefore == pos ? pos + 1 : pos;
        double centralityGain = Math.max(0.0, Math.abs(heavyBefore - center) - Math.abs(lightBefore - center));
        double endBiasGain = Math.max(0.0, endDistance(heavyBefore, n) - endDistance(lightBefore, n));
        double pendulumBias = CENTRALITY_WEIGHT * centralityGain + END_BIAS_WEIGHT * endBiasGain;

        double smoothGain = Math.max(0.0, roughness(sequence, pos, false) - roughness(sequence, pos, true));

        boolean critical = matrix.time(a, bottleneck) >= criticalThreshold
                || matrix.time(b, bottleneck) >= criticalThreshold;

        return bottleneckDiff + totalDiff + pendulumBias + SMOOTHNESS_WEIGHT * smoothGain
                + (critical ? CRITICAL_BONUS : 0.0);
    }

    /** Pair positions 0..n-2, highest score first; equal scores keep position order. */
    List<Integer> rank(JobSequence sequence) {
        int pairs = sequence.size() - 1;
        double[] scores = new double[Math.max(pairs, 0)];
        List<Integer> positions = new ArrayList<>(scores.length);
        for (int pos = 0; pos < pairs; pos++) {
            scores[pos] = score(sequence, pos);
            positions.add(pos);
        }
        positions.sort(Comparator.comparingDouble((Integer pos) -> scores[pos]).reversed());
        return positions;
    }

    double getCriticalThreshold() {
        return criticalThreshold;
    }

    private static double endDistance(int pos, int n) {
        return Math.min(pos, (n - 1) - pos);
    }

    /** Sum of |total(k) - total(k+1)| for k in pos-1..pos+1, optionally with the pair swapped. */
    private double roughness(JobSequence sequence, int pos, boolean swapped) {
        int n = sequence.size();
        double sum = 0.0;
        for (int k = pos - 1; k <= pos + 1; k++) {
            if (k >= 0 && k < n - 1) {
                sum += Math.abs(jobTotals[jobAt(sequence, k, pos, swapped)] - jobTotals[jobAt(sequence, k + 1, pos, swapped)]);
            }
        }
        return sum;
    }

    private static int jobAt(JobSequence sequence, int i, int pos, boolean swapped) {
        if (swapped && i == pos) {
            return sequence.jobAt(pos + 1);
        }
        if (swapped && i == pos + 1) {
            return sequence.jobAt(pos);
        }
        return sequence.jobAt(i);
    }
}
