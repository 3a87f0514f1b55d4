package com.iimsoft.flowshop.api.dto;

import java.util.List;

public class SolveResponse {

    public String bestMethod;
    public List<Integer> bestSequence;
    public List<String> bestJobNames;
    public double bestMakespan;

    /** 最优序列下每台机器的空闲：makespan − 该机器总负荷 */
    public double[] machineIdleTimes;

    /** 最优序列下每台机器在相邻作业之间的等待时间 */
    public double[] waitingIdleTimes;

    /** 总负荷最大的机器（0 起） */
    public int bottleneckMachine;

    /** 各方法结果，按 makespan 升序（并列按运行顺序） */
    public List<MethodRow> comparison;

    public static class MethodRow {
        public String method;
        public double makespan;
        public List<Integer> sequence;
        public List<String> jobNames;
        public int iterations;
    }
}
