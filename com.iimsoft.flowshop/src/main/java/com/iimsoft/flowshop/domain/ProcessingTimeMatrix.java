package com.iimsoft.flowshop.domain;

import com.iimsoft.flowshop.exception.DimensionException;
import com.iimsoft.flowshop.exception.DomainException;

import java.util.Arrays;

/**
 * 加工时间矩阵：行 = 作业，列 = 机器（所有作业按相同机器顺序加工）。
 * - 构造时校验：非空、矩形、每个元素为有限非负数
 * - 构造后不可变（内部做防御性拷贝）
 */
public final class ProcessingTimeMatrix {

    private static final String COMPONENT = "ProcessingTimeMatrix";

    private final double[][] times;
    private final int jobCount;
    private final int machineCount;

    private ProcessingTimeMatrix(double[][] times) {
        this.times = times;
        this.jobCount = times.length;
        this.machineCount = times[0].length;
    }

    public static ProcessingTimeMatrix of(double[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new DimensionException(COMPONENT, "matrix must have at least one job row");
        }
        if (rows[0] == null || rows[0].length == 0) {
            throw new DimensionException(COMPONENT, "matrix must have at least one machine column");
        }
        int m = rows[0].length;
        double[][] copy = new double[rows.length][];
        for (int j = 0; j < rows.length; j++) {
            double[] row = rows[j];
            if (row == null || row.length != m) {
                throw new DimensionException(COMPONENT, String.format(
                        "row %d has %d columns, expected %d", j, row == null ? 0 : row.length, m));
            }
            for (int k = 0; k < m; k++) {
                double p = row[k];
                if (Double.isNaN(p) || Double.isInfinite(p)) {
                    throw new DomainException(COMPONENT, String.format("p[%d][%d] is not finite: %s", j, k, p));
                }
                if (p < 0) {
                    throw new DomainException(COMPONENT, String.format("p[%d][%d] is negative: %s", j, k, p));
                }
            }
            copy[j] = row.clone();
        }
        return new ProcessingTimeMatrix(copy);
    }

    public int jobCount() {
        return jobCount;
    }

    public int machineCount() {
        return machineCount;
    }

    public double time(int job, int machine) {
        return times[job][machine];
    }

    /** Sum over all machines, accumulated in machine order. */
    public double totalTime(int job) {
        return sumRange(job, 0, machineCount);
    }

    /** Sum of p[job][from..to-1]. */
    public double sumRange(int job, int fromMachine, int toMachine) {
        double sum = 0.0;
        for (int k = fromMachine; k < toMachine; k++) {
            sum += times[job][k];
        }
        return sum;
    }

    /** Sum over all jobs on one machine. */
    public double machineLoad(int machine) {
        double sum = 0.0;
        for (int j = 0; j < jobCount; j++) {
            sum += times[j][machine];
        }
        return sum;
    }

    public double[] row(int job) {
        return times[job].clone();
    }

    public double[][] toArray() {
        double[][] copy = new double[jobCount][];
        for (int j = 0; j < jobCount; j++) {
            copy[j] = times[j].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcessingTimeMatrix)) return false;
        return Arrays.deepEquals(times, ((ProcessingTimeMatrix) o).times);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(times);
    }

    @Override
    public String toString() {
        return "ProcessingTimeMatrix{" + jobCount + " jobs x " + machineCount + " machines}";
    }
}
