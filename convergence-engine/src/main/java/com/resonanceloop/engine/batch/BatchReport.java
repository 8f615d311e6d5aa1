package com.resonanceloop.engine.batch;

import com.resonanceloop.common.model.ConvergenceResult;

import java.util.List;

public record BatchReport(
    BatchSummary summary,
    List<ConvergenceResult> results
) {
    public static BatchReport of(List<ConvergenceResult> results) {
        return new BatchReport(BatchSummary.of(results), results);
    }
}
