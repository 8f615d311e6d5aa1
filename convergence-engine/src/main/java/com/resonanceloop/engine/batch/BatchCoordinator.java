package com.resonanceloop.engine.batch;

import com.resonanceloop.common.model.ConvergencePair;
import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.model.FailureCause;
import com.resonanceloop.common.trace.TraceContextUtil;
import com.resonanceloop.engine.convergence.ConvergenceController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs many convergence loops concurrently.
 *
 * <p>At most {@code maxConcurrent} runs are active at any instant ({@code flatMap} concurrency).
 * Since a run has at most one exchange in flight, this also bounds concurrent Oracle calls.
 * A failure inside one run becomes an ERROR result for that pair only; siblings are unaffected.
 * Results come back in submission order regardless of completion order.
 */
@Service
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final ConvergenceController controller;
    private final int defaultMaxConcurrent;

    public BatchCoordinator(ConvergenceController controller,
                            @Value("${batch.max-concurrent:2}") int defaultMaxConcurrent) {
        this.controller = controller;
        this.defaultMaxConcurrent = defaultMaxConcurrent;
    }

    public int defaultMaxConcurrent() {
        return defaultMaxConcurrent;
    }

    public Mono<List<ConvergenceResult>> runBatch(List<ConvergencePair> pairs) {
        return runBatch(pairs, defaultMaxConcurrent);
    }

    public Mono<List<ConvergenceResult>> runBatch(List<ConvergencePair> pairs, int maxConcurrent) {
        if (maxConcurrent < 1) {
            return Mono.error(new IllegalArgumentException("maxConcurrent must be >= 1, got " + maxConcurrent));
        }
        if (pairs == null || pairs.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            BatchResultCollector collector = new BatchResultCollector(pairs.size());
            log.info("[Batch] Starting batch. pairs={} maxConcurrent={}", pairs.size(), maxConcurrent);

            return Flux.range(0, pairs.size())
                .flatMap(i -> runIsolated(i, pairs.get(i))
                                  .doOnNext(result -> collector.record(i, result)),
                         maxConcurrent)
                .then(Mono.fromCallable(collector::results))
                .doOnNext(results -> {
                    BatchSummary summary = BatchSummary.of(results);
                    log.info("[Batch] Batch complete. total={} succeeded={} failed={} errored={} elapsedMs={}",
                             summary.total(), summary.succeeded(), summary.failed(), summary.errored(),
                             (System.nanoTime() - startNanos) / 1_000_000);
                });
        });
    }

    private Mono<ConvergenceResult> runIsolated(int index, ConvergencePair pair) {
        return Mono.defer(() -> controller.converge(pair))
            .onErrorResume(e -> {
                log.error("[Batch] Task failed, isolating. slot={} profile={} reason={}",
                          index, pair != null ? pair.profileId() : null, e.toString());
                return Mono.just(ConvergenceResult.aborted(
                    TraceContextUtil.newRunId(),
                    pair != null ? pair.profileId() : null,
                    pair != null ? pair.scenario() : null,
                    FailureCause.BATCH_TASK_ERROR,
                    pair != null ? pair.thresholdOr(controller.settings().threshold())
                                 : controller.settings().threshold(),
                    0L,
                    "batch task failed: " + e));
            });
    }
}
