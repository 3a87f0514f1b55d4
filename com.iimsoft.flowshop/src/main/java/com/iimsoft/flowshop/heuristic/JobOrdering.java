package com.iimsoft.flowshop.heuristic;

import com.iimsoft.flowshop.domain.JobSequence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/** 按作业键值稳定排序（List.sort 为归并排序，相等键保持原索引顺序）。 */
final class JobOrdering {

    private JobOrdering() {
    }

    static List<Integer> sortJobs(List<Integer> jobs, IntToDoubleFunction key, boolean descending) {
        List<Integer> sorted = new ArrayList<>(jobs);
        Comparator<Integer> byKey = Comparator.comparingDouble(key::applyAsDouble);
        sorted.sort(descending ? byKey.reversed() : byKey);
        return sorted;
    }

    static List<Integer> sortAllJobs(int n, IntToDoubleFunction key, boolean descending) {
        List<Integer> jobs = new ArrayList<>(n);
        for (int j = 0; j < n; j++) {
            jobs.add(j);
        }
        return sortJobs(jobs, key, descending);
    }

    static JobSequence sequenceOf(int n, IntToDoubleFunction key, boolean descending) {
        return JobSequence.of(sortAllJobs(n, key, descending));
    }
}
