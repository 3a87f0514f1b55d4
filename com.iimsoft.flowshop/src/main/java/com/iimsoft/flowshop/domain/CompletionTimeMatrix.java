package com.iimsoft.flowshop.domain;

/**
 * C[i][j]：序列中第 i 个作业在机器 j 上的完工时间。
 * 由 MakespanEvaluator 生成；只读视图。
 */
public final class CompletionTimeMatrix {

    private final double[][] completion;

    public CompletionTimeMatrix(double[][] completion) {
        this.completion = completion;
    }

    public int rows() {
        return completion.length;
    }

    public int machines() {
        return completion.length == 0 ? 0 : completion[0].length;
    }

    public double at(int position, int machine) {
        return completion[position][machine];
    }

    public double makespan() {
        return completion[completion.length - 1][machines() - 1];
    }

    public double[][] toArray() {
        double[][] copy = new double[completion.length][];
        for (int i = 0; i < completion.length; i++) {
            copy[i] = completion[i].clone();
        }
        return copy;
    }
}
