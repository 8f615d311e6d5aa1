package com.resonanceloop.engine.batch;

import com.resonanceloop.common.model.ConvergenceResult;

import java.util.List;

public record BatchSummary(
    int total,
    int succeeded,
    int failed,
    int errored,
    double successRate
) {
    public static BatchSummary of(List<ConvergenceResult> results) {
        int succeeded = 0;
        int failed = 0;
        int errored = 0;
        for (ConvergenceResult r : results) {
            switch (r.status()) {
                case SUCCESS -> succeeded++;
                case FAILURE -> failed++;
                case ERROR -> errored++;
            }
        }
        int total = results.size();
        return new BatchSummary(total, succeeded, failed, errored,
                                total == 0 ? 0.0 : (double) succeeded / total);
    }
}
