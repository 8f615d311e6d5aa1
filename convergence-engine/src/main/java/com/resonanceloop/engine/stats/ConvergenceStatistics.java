package com.resonanceloop.engine.stats;

import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.model.ConvergenceStatus;
import com.resonanceloop.common.model.FailureCause;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running totals of terminated runs, by status and by cause.
 */
@Component
public class ConvergenceStatistics {

    private final Map<ConvergenceStatus, LongAdder> byStatus = new EnumMap<>(ConvergenceStatus.class);
    private final Map<FailureCause, LongAdder> byCause = new EnumMap<>(FailureCause.class);
    private final LongAdder attempts = new LongAdder();

    public ConvergenceStatistics() {
        for (ConvergenceStatus s : ConvergenceStatus.values()) byStatus.put(s, new LongAdder());
        for (FailureCause c : FailureCause.values()) byCause.put(c, new LongAdder());
    }

    public void record(ConvergenceResult result) {
        byStatus.get(result.status()).increment();
        byCause.get(result.cause()).increment();
        attempts.add(result.totalAttempts());
    }

    public Snapshot snapshot() {
        long success = byStatus.get(ConvergenceStatus.SUCCESS).sum();
        long failure = byStatus.get(ConvergenceStatus.FAILURE).sum();
        long error = byStatus.get(ConvergenceStatus.ERROR).sum();
        long total = success + failure + error;
        Map<FailureCause, Long> causes = new EnumMap<>(FailureCause.class);
        byCause.forEach((cause, adder) -> causes.put(cause, adder.sum()));
        return new Snapshot(total, success, failure, error,
                            total == 0 ? 0.0 : (double) success / total,
                            total == 0 ? 0.0 : (double) attempts.sum() / total,
                            causes);
    }

    public record Snapshot(
        long totalRuns,
        long successes,
        long failures,
        long errors,
        double successRate,
        double averageAttempts,
        Map<FailureCause, Long> causes
    ) {}
}
