package com.iimsoft.flowshop.service;

import com.iimsoft.flowshop.domain.JobSequence;
import lombok.AllArgsConstructor;
import lombok.Data;

/** One row of the comparison table. */
@Data
@AllArgsConstructor
public class MethodResult {
    String method;
    JobSequence sequence;
    double makespan;
    int iterations;
}
