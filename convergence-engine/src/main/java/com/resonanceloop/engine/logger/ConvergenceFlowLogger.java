package com.resonanceloop.engine.logger;

import com.resonanceloop.common.model.AttemptRecord;
import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Logs each stage of a convergence run. Pure side effects, no control flow.
 *
 * <p>Stages in order:
 * <ol>
 *   <li>{@link #RUN_STARTED}      profile resolved, initial request composed</li>
 *   <li>{@link #ATTEMPT_SENT}     request handed to the transport</li>
 *   <li>{@link #ATTEMPT_SCORED}   outcome recorded, with or without breakdown</li>
 *   <li>{@link #REQUEST_MUTATED}  next request derived by the mutator</li>
 *   <li>{@link #RUN_TERMINATED}   result assembled</li>
 * </ol>
 */
@Component
public class ConvergenceFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceFlowLogger.class);

    public static final String RUN_STARTED     = "RUN_STARTED";
    public static final String ATTEMPT_SENT    = "ATTEMPT_SENT";
    public static final String ATTEMPT_SCORED  = "ATTEMPT_SCORED";
    public static final String REQUEST_MUTATED = "REQUEST_MUTATED";
    public static final String RUN_TERMINATED  = "RUN_TERMINATED";

    public void runStarted(String runId, String profileId, int maxAttempts, double threshold) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[ConvergenceFlow] stage={} runId={} profile={} maxAttempts={} threshold={}",
                     RUN_STARTED, runId, profileId, maxAttempts, threshold));
    }

    public void attemptSent(String runId, int index, int revision) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[ConvergenceFlow] stage={} runId={} attempt={} revision={}",
                     ATTEMPT_SENT, runId, index, revision));
    }

    public void attemptScored(String runId, AttemptRecord attempt) {
        TraceContextUtil.withMdc(runId, () -> {
            if (attempt.scored()) {
                log.info("[ConvergenceFlow] stage={} runId={} attempt={} overall={} weakest={} latencyMs={}",
                         ATTEMPT_SCORED, runId, attempt.index(),
                         String.format(Locale.ROOT, "%.3f", attempt.overall()),
                         attempt.breakdown().weakestDimension(), attempt.outcome().latencyMs());
            } else {
                log.warn("[ConvergenceFlow] stage={} runId={} attempt={} overall=0 transportError={} detail={}",
                         ATTEMPT_SCORED, runId, attempt.index(),
                         attempt.outcome().errorKind(), attempt.outcome().errorDetail());
            }
        });
    }

    public void requestMutated(String runId, int fromAttempt, String strategyTag) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[ConvergenceFlow] stage={} runId={} afterAttempt={} strategy={}",
                     REQUEST_MUTATED, runId, fromAttempt, strategyTag));
    }

    public void runTerminated(ConvergenceResult result) {
        TraceContextUtil.withMdc(result.runId(), () ->
            log.info("[ConvergenceFlow] stage={} runId={} profile={} status={} cause={} attempts={} "
                     + "bestOverall={} elapsedMs={} reason=\"{}\"",
                     RUN_TERMINATED, result.runId(), result.profileId(), result.status(), result.cause(),
                     result.totalAttempts(), String.format(Locale.ROOT, "%.3f", result.bestOverall()),
                     result.elapsedMs(), result.reason()));
    }
}
