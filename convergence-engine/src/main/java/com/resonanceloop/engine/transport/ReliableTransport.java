package com.resonanceloop.engine.transport;

import com.resonanceloop.common.model.Outcome;
import com.resonanceloop.common.model.Request;
import com.resonanceloop.common.model.TransportErrorKind;
import com.resonanceloop.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reliability layer in front of the {@link OracleClient}.
 *
 * <p>Each {@link #send} performs up to {@code maxRetries} exchanges. Every exchange carries its
 * own hard timeout. Failures are classified by {@link FailureClassifier}; retryable kinds wait
 * {@link BackoffPolicy#delayFor} before the next exchange, {@code MALFORMED_REQUEST} stops at once.
 *
 * <p><strong>Reactive contract</strong>: the returned {@code Mono} always emits one {@link Outcome}.
 * No error signal ever reaches the caller, and no thread is blocked while backing off.
 */
public class ReliableTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(ReliableTransport.class);

    private final OracleClient oracleClient;
    private final OracleParams params;
    private final TransportSettings settings;
    private final TransportTelemetry telemetry;

    public ReliableTransport(OracleClient oracleClient, OracleParams params,
                             TransportSettings settings, TransportTelemetry telemetry) {
        this.oracleClient = oracleClient;
        this.params = params;
        this.settings = settings;
        this.telemetry = telemetry;
    }

    @Override
    public Mono<Outcome> send(Request request) {
        return Mono.deferContextual(ctx -> {
            String runId = TraceContextUtil.getRunId(ctx);
            long startNanos = System.nanoTime();
            return exchange(request, 1, startNanos, runId)
                .onErrorResume(e -> {
                    TraceContextUtil.withMdc(runId, () ->
                        log.error("[Transport] Unexpected failure outside the retry loop. runId={} reason={}",
                                  runId, e.toString()));
                    return Mono.just(Outcome.failure(TransportErrorKind.UPSTREAM_ERROR,
                                                     e.toString(), elapsedMs(startNanos), 0));
                });
        });
    }

    private Mono<Outcome> exchange(Request request, int attempt, long startNanos, String runId) {
        return Mono.defer(() -> {
                telemetry.recordExchange();
                return oracleClient.sendRaw(request.prompt(), request.directive(), params);
            })
            .timeout(settings.requestTimeout())
            .map(ExchangeResult::of)
            .switchIfEmpty(Mono.fromSupplier(() ->
                ExchangeResult.failed(TransportErrorKind.EMPTY_CONTENT, "oracle completed without a response")))
            .onErrorResume(e -> Mono.just(ExchangeResult.failed(FailureClassifier.classify(e), e.toString())))
            .flatMap(result -> {
                if (result.kind() == null) {
                    telemetry.recordSuccess();
                    log.debug("[Transport] Exchange succeeded. runId={} attempt={} status={}",
                              runId, attempt, result.raw().statusCode());
                    return Mono.just(Outcome.success(result.raw().content(), elapsedMs(startNanos),
                                                     attempt, result.raw().usage()));
                }

                TransportErrorKind kind = result.kind();
                telemetry.recordFailure(kind);
                if (!kind.retryable()) {
                    TraceContextUtil.withMdc(runId, () ->
                        log.warn("[Transport] Non-retryable failure, aborting. runId={} attempt={} kind={} detail={}",
                                 runId, attempt, kind, result.detail()));
                    return Mono.just(Outcome.failure(kind, result.detail(), elapsedMs(startNanos), attempt));
                }
                if (attempt >= settings.maxRetries()) {
                    TraceContextUtil.withMdc(runId, () ->
                        log.warn("[Transport] Retry budget exhausted. runId={} attempts={} kind={} detail={}",
                                 runId, attempt, kind, result.detail()));
                    return Mono.just(Outcome.failure(kind, result.detail(), elapsedMs(startNanos), attempt));
                }

                Duration wait = BackoffPolicy.delayFor(kind, settings.baseDelay(), attempt);
                TraceContextUtil.withMdc(runId, () ->
                    log.warn("[Transport] Retryable failure. runId={} attempt={}/{} kind={} backoffMs={} detail={}",
                             runId, attempt, settings.maxRetries(), kind, wait.toMillis(), result.detail()));
                return Mono.delay(wait).then(exchange(request, attempt + 1, startNanos, runId));
            });
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    /** Classified exchange; {@code kind == null} means usable content. */
    private record ExchangeResult(RawExchange raw, TransportErrorKind kind, String detail) {

        static ExchangeResult of(RawExchange raw) {
            TransportErrorKind kind = FailureClassifier.classify(raw);
            String detail = kind == null ? null : describe(raw, kind);
            return new ExchangeResult(raw, kind, detail);
        }

        static ExchangeResult failed(TransportErrorKind kind, String detail) {
            return new ExchangeResult(null, kind, detail);
        }

        private static String describe(RawExchange raw, TransportErrorKind kind) {
            if (kind == TransportErrorKind.EMPTY_CONTENT) {
                return "HTTP " + raw.statusCode() + " with no text content";
            }
            return "HTTP " + raw.statusCode() + (raw.detail() != null ? ": " + raw.detail() : "");
        }
    }
}
