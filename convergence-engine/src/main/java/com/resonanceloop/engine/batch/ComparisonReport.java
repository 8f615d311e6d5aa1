package com.resonanceloop.engine.batch;

import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.model.ConvergenceStatus;

import java.util.List;

/**
 * One scenario run against several profiles, ranked by best overall score.
 */
public record ComparisonReport(
    String scenario,
    String leadingProfileId,
    List<Entry> ranking,
    List<ConvergenceResult> results
) {
    public record Entry(
        int rank,
        String profileId,
        ConvergenceStatus status,
        double bestOverall,
        int totalAttempts,
        Integer successfulAttempt
    ) {}
}
