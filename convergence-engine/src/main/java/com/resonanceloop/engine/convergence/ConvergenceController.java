package com.resonanceloop.engine.convergence;

import com.resonanceloop.common.exception.ProfileNotFoundException;
import com.resonanceloop.common.model.AttemptRecord;
import com.resonanceloop.common.model.ConvergencePair;
import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.model.ConvergenceStatus;
import com.resonanceloop.common.model.FailureCause;
import com.resonanceloop.common.model.Outcome;
import com.resonanceloop.common.model.Request;
import com.resonanceloop.common.model.ScoreBreakdown;
import com.resonanceloop.common.mutation.MutationResult;
import com.resonanceloop.common.mutation.PromptComposer;
import com.resonanceloop.common.mutation.RequestMutator;
import com.resonanceloop.common.profile.ProfileStore;
import com.resonanceloop.common.profile.TargetProfile;
import com.resonanceloop.common.provenance.ProvenanceSink;
import com.resonanceloop.common.scoring.ResonanceScorer;
import com.resonanceloop.common.trace.TraceContextUtil;
import com.resonanceloop.engine.logger.ConvergenceFlowLogger;
import com.resonanceloop.engine.stats.ConvergenceStatistics;
import com.resonanceloop.engine.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Drives the attempt loop for one (profile, scenario) pair.
 *
 * <pre>
 *   INIT → SEND → EVALUATE → DECIDE → { MUTATE → SEND | TERMINAL }
 * </pre>
 *
 * <ul>
 *   <li>SEND: {@link Transport#send}, which retries transient failures on its own budget</li>
 *   <li>EVALUATE: a successful outcome is scored; a failed one counts as a zero-score attempt</li>
 *   <li>DECIDE: {@code overall ≥ threshold} ends the run as SUCCESS; the last permitted attempt ends
 *       it as FAILURE (best attempt below threshold) or ERROR (no attempt was ever scored)</li>
 *   <li>MUTATE: after a scored attempt the mutator derives the next request; after a transport
 *       failure the same request is sent again. Either way the fixed inter-attempt delay applies.</li>
 * </ul>
 *
 * <p>Transport failures and quality shortfalls consume the same attempt counter. Attempts within
 * a run are strictly sequential; the run has no wall-clock deadline, only the attempt budget.
 * Cancellation is polled before each attempt and when an in-flight exchange completes.
 */
@Service
public class ConvergenceController {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceController.class);

    private final ProfileStore profileStore;
    private final Transport transport;
    private final ResonanceScorer scorer;
    private final RequestMutator mutator;
    private final ProvenanceSink provenanceSink;
    private final ConvergenceSettings settings;
    private final ConvergenceFlowLogger flowLogger;
    private final ConvergenceStatistics statistics;

    public ConvergenceController(ProfileStore profileStore,
                                 Transport transport,
                                 ResonanceScorer scorer,
                                 RequestMutator mutator,
                                 ProvenanceSink provenanceSink,
                                 ConvergenceSettings settings,
                                 ConvergenceFlowLogger flowLogger,
                                 ConvergenceStatistics statistics) {
        this.profileStore = profileStore;
        this.transport = transport;
        this.scorer = scorer;
        this.mutator = mutator;
        this.provenanceSink = provenanceSink;
        this.settings = settings;
        this.flowLogger = flowLogger;
        this.statistics = statistics;
    }

    public ConvergenceSettings settings() {
        return settings;
    }

    public Mono<ConvergenceResult> converge(ConvergencePair pair) {
        return converge(pair, CancellationToken.create());
    }

    /**
     * Runs the loop to completion. Emits exactly one {@link ConvergenceResult}.
     *
     * @param pair  profile and scenario, with optional budget and threshold overrides
     * @param token cooperative cancellation flag
     */
    public Mono<ConvergenceResult> converge(ConvergencePair pair, CancellationToken token) {
        String runId = TraceContextUtil.newRunId();
        Mono<ConvergenceResult> pipeline = Mono.defer(() -> start(runId, pair, token))
            .doOnNext(result -> {
                statistics.record(result);
                flowLogger.runTerminated(result);
            });
        return TraceContextUtil.withRunId(pipeline, runId);
    }

    // ── INIT ──────────────────────────────────────────────────────────────────

    private Mono<ConvergenceResult> start(String runId, ConvergencePair pair, CancellationToken token) {
        long startNanos = System.nanoTime();
        int maxAttempts = pair.maxAttemptsOr(settings.maxAttempts());
        double threshold = pair.thresholdOr(settings.threshold());

        TargetProfile profile;
        try {
            profile = profileStore.getProfile(pair.profileId());
        } catch (ProfileNotFoundException e) {
            TraceContextUtil.withMdc(runId, () ->
                log.warn("[Convergence] Unknown profile, aborting before any attempt. runId={} profile={}",
                         runId, pair.profileId()));
            return Mono.just(ConvergenceResult.aborted(runId, pair.profileId(), pair.scenario(),
                FailureCause.PROFILE_NOT_FOUND, threshold, elapsedMs(startNanos),
                "profile '" + pair.profileId() + "' not found"));
        }

        RunLedger ledger = new RunLedger(runId, pair, profile, maxAttempts, threshold, startNanos);
        flowLogger.runStarted(runId, profile.profileId(), maxAttempts, threshold);
        return attempt(ledger, PromptComposer.initialRequest(profile, pair.scenario()), 1, null, token);
    }

    // ── SEND / EVALUATE ───────────────────────────────────────────────────────

    private Mono<ConvergenceResult> attempt(RunLedger ledger, Request request, int index,
                                            String strategyTag, CancellationToken token) {
        if (token.isCancelled()) {
            return Mono.just(cancelled(ledger, "run cancelled before attempt " + index));
        }
        flowLogger.attemptSent(ledger.runId, index, request.revision());

        return transport.send(request).flatMap(outcome -> {
            if (token.isCancelled()) {
                TraceContextUtil.withMdc(ledger.runId, () ->
                    log.info("[Convergence] Cancelled while in flight, discarding outcome. runId={} attempt={}",
                             ledger.runId, index));
                return Mono.just(cancelled(ledger, "run cancelled during attempt " + index));
            }
            ScoreBreakdown breakdown = outcome.success() ? scorer.score(outcome.content(), ledger.profile) : null;
            AttemptRecord record = new AttemptRecord(index, request, outcome, breakdown, strategyTag, Instant.now());
            ledger.append(record);
            flowLogger.attemptScored(ledger.runId, record);
            return decide(ledger, record, token);
        });
    }

    // ── DECIDE / MUTATE ───────────────────────────────────────────────────────

    private Mono<ConvergenceResult> decide(RunLedger ledger, AttemptRecord record, CancellationToken token) {
        if (record.scored() && record.overall() >= ledger.threshold) {
            ConvergenceResult result = succeeded(ledger, record);
            persistBestEffort(result);
            return Mono.just(result);
        }
        if (record.index() >= ledger.maxAttempts) {
            return Mono.just(exhausted(ledger));
        }

        final Request next;
        final String tag;
        if (record.scored()) {
            MutationResult mutation = mutator.mutate(record.request(), ledger.profile,
                                                     record.breakdown(), record.index());
            next = mutation.request();
            tag = mutation.strategyTag();
            flowLogger.requestMutated(ledger.runId, record.index(), tag);
        } else {
            next = record.request();
            tag = null;
            TraceContextUtil.withMdc(ledger.runId, () ->
                log.info("[Convergence] Re-sending unchanged request after transport failure. runId={} attempt={}",
                         ledger.runId, record.index() + 1));
        }

        return Mono.delay(settings.interAttemptDelay())
            .then(Mono.defer(() -> attempt(ledger, next, record.index() + 1, tag, token)));
    }

    private void persistBestEffort(ConvergenceResult result) {
        try {
            provenanceSink.persist(result);
        } catch (RuntimeException e) {
            TraceContextUtil.withMdc(result.runId(), () ->
                log.warn("[Convergence] Provenance persist failed (non-critical). runId={} reason={}",
                         result.runId(), e.toString()));
        }
    }

    // ── TERMINAL ──────────────────────────────────────────────────────────────

    private ConvergenceResult succeeded(RunLedger ledger, AttemptRecord record) {
        String reason = String.format(Locale.ROOT,
            "converged at attempt %d with overall %.3f >= threshold %.3f",
            record.index(), record.overall(), ledger.threshold);
        return ledger.result(ConvergenceStatus.SUCCESS, FailureCause.NONE, record.index(), reason);
    }

    private ConvergenceResult exhausted(RunLedger ledger) {
        AttemptRecord best = ledger.best;
        if (best == null) {
            Outcome last = ledger.attempts.get(ledger.attempts.size() - 1).outcome();
            String reason = String.format(Locale.ROOT,
                "no valid outcome in %d attempts; last transport error %s: %s",
                ledger.attempts.size(), last.errorKind(), last.errorDetail());
            return ledger.result(ConvergenceStatus.ERROR, FailureCause.TRANSPORT_EXHAUSTED, null, reason);
        }
        ScoreBreakdown b = best.breakdown();
        String reason = String.format(Locale.ROOT,
            "attempt budget of %d exhausted; best overall %.3f (attempt %d) below threshold %.3f; "
            + "weakest dimension %s=%.3f",
            ledger.maxAttempts, best.overall(), best.index(), ledger.threshold,
            b.weakestDimension().key(), b.score(b.weakestDimension()));
        return ledger.result(ConvergenceStatus.FAILURE, FailureCause.CONVERGENCE_EXHAUSTED, null, reason);
    }

    private ConvergenceResult cancelled(RunLedger ledger, String reason) {
        return ledger.result(ConvergenceStatus.ERROR, FailureCause.CANCELLED, null, reason);
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    /**
     * Per-run state. Touched by one attempt at a time, never shared between runs.
     */
    private static final class RunLedger {
        final String runId;
        final ConvergencePair pair;
        final TargetProfile profile;
        final int maxAttempts;
        final double threshold;
        final long startNanos;
        final List<AttemptRecord> attempts = new ArrayList<>();
        AttemptRecord best;

        RunLedger(String runId, ConvergencePair pair, TargetProfile profile,
                  int maxAttempts, double threshold, long startNanos) {
            this.runId = runId;
            this.pair = pair;
            this.profile = profile;
            this.maxAttempts = maxAttempts;
            this.threshold = threshold;
            this.startNanos = startNanos;
        }

        void append(AttemptRecord record) {
            attempts.add(record);
            if (record.scored() && (best == null || record.overall() > best.overall())) {
                best = record;
            }
        }

        ConvergenceResult result(ConvergenceStatus status, FailureCause cause,
                                 Integer successfulAttempt, String reason) {
            return new ConvergenceResult(runId, profile.profileId(), pair.scenario(), status, cause,
                                         best, attempts, attempts.size(), successfulAttempt,
                                         best != null ? best.overall() : 0.0, threshold,
                                         elapsedMs(startNanos), reason, Instant.now());
        }
    }
}
