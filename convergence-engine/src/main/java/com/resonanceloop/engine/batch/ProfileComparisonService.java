package com.resonanceloop.engine.batch;

import com.resonanceloop.common.model.ConvergencePair;
import com.resonanceloop.common.model.ConvergenceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Runs one scenario against several profiles through the {@link BatchCoordinator} and ranks
 * the profiles by the best overall score each reached. Ties keep submission order.
 */
@Service
public class ProfileComparisonService {

    private static final Logger log = LoggerFactory.getLogger(ProfileComparisonService.class);

    private final BatchCoordinator batchCoordinator;

    public ProfileComparisonService(BatchCoordinator batchCoordinator) {
        this.batchCoordinator = batchCoordinator;
    }

    public Mono<ComparisonReport> compare(String scenario, List<String> profileIds,
                                          Integer maxAttempts, Double threshold, int maxConcurrent) {
        if (profileIds == null || profileIds.isEmpty()) {
            return Mono.error(new IllegalArgumentException("at least one profileId is required"));
        }
        List<ConvergencePair> pairs = new ArrayList<>();
        try {
            for (String id : new LinkedHashSet<>(profileIds)) {
                pairs.add(new ConvergencePair(id, scenario, maxAttempts, threshold));
            }
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }

        return batchCoordinator.runBatch(pairs, maxConcurrent)
            .map(results -> rank(scenario, results))
            .doOnNext(report -> log.info("[Comparison] Ranked profiles. leader={} profiles={}",
                                         report.leadingProfileId(), report.ranking().size()));
    }

    static ComparisonReport rank(String scenario, List<ConvergenceResult> results) {
        List<ConvergenceResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingDouble(ConvergenceResult::bestOverall).reversed());

        List<ComparisonReport.Entry> ranking = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            ConvergenceResult r = ordered.get(i);
            ranking.add(new ComparisonReport.Entry(i + 1, r.profileId(), r.status(),
                                                    round(r.bestOverall()), r.totalAttempts(),
                                                    r.successfulAttempt()));
        }
        String leader = ranking.isEmpty() ? null : ranking.get(0).profileId();
        return new ComparisonReport(scenario, leader, ranking, results);
    }

    private static double round(double v) {
        return Double.parseDouble(String.format(Locale.ROOT, "%.4f", v));
    }
}
