package com.iimsoft.flowshop.domain;

import com.iimsoft.flowshop.exception.DimensionException;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 作业序列（不可变）：job 索引的有序列表。
 * 交换、插入等“移动”都返回新实例，原序列保持不变，直到调用方决定接受。
 */
public final class JobSequence {

    private final int[] jobs;

    private JobSequence(int[] jobs) {
        this.jobs = jobs;
    }

    /** Copies the given indices; no permutation check (see {@link #requirePermutationOf}). */
    public static JobSequence of(int... jobs) {
        return new JobSequence(jobs.clone());
    }

    public static JobSequence of(List<Integer> jobs) {
        return new JobSequence(jobs.stream().mapToInt(Integer::intValue).toArray());
    }

    public static JobSequence identity(int n) {
        return new JobSequence(IntStream.range(0, n).toArray());
    }

    /** Fisher-Yates over 0..n-1 driven by the caller's random source. */
    public static JobSequence random(int n, Random random) {
        int[] a = IntStream.range(0, n).toArray();
        for (int i = n - 1; i > 0; i--) {
            int r = random.nextInt(i + 1);
            int t = a[i]; a[i] = a[r]; a[r] = t;
        }
        return new JobSequence(a);
    }

    public int size() {
        return jobs.length;
    }

    public int jobAt(int position) {
        return jobs[position];
    }

    public int[] toArray() {
        return jobs.clone();
    }

    public List<Integer> toList() {
        return Arrays.stream(jobs).boxed().collect(Collectors.toList());
    }

    /** 2-opt move: positions i and j exchanged. */
    public JobSequence swap(int i, int j) {
        int[] a = jobs.clone();
        int t = a[i]; a[i] = a[j]; a[j] = t;
        return new JobSequence(a);
    }

    /** Insertion move: job at {@code from} removed, then placed so it ends up at index {@code to}. */
    public JobSequence move(int from, int to) {
        int[] a = jobs.clone();
        int job = a[from];
        if (from < to) {
            System.arraycopy(a, from + 1, a, from, to - from);
        } else if (from > to) {
            System.arraycopy(a, to, a, to + 1, from - to);
        }
        a[to] = job;
        return new JobSequence(a);
    }

    /** Partial sequence with {@code job} inserted before {@code position} (NEH). */
    public JobSequence insert(int position, int job) {
        int[] a = new int[jobs.length + 1];
        System.arraycopy(jobs, 0, a, 0, position);
        a[position] = job;
        System.arraycopy(jobs, position, a, position + 1, jobs.length - position);
        return new JobSequence(a);
    }

    public boolean isPermutationOf(int n) {
        if (jobs.length != n) return false;
        boolean[] seen = new boolean[n];
        for (int job : jobs) {
            if (job < 0 || job >= n || seen[job]) return false;
            seen[job] = true;
        }
        return true;
    }

    public JobSequence requirePermutationOf(int n, String component) {
        if (!isPermutationOf(n)) {
            throw new DimensionException(component, String.format(
                    "sequence %s is not a permutation of job indices 0..%d", this, n - 1));
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobSequence)) return false;
        return Arrays.equals(jobs, ((JobSequence) o).jobs);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(jobs);
    }

    @Override
    public String toString() {
        return Arrays.toString(jobs);
    }
}
