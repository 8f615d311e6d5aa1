package com.resonanceloop.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the run identifier through reactive pipelines.
 *
 * <p>The Reactor Context holds the runId inside a pipeline. MDC is written only for the
 * duration of a single log statement and removed immediately after.
 *
 * <pre>
 *     return TraceContextUtil.withRunId(pipeline, runId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private TraceContextUtil() {}

    public static String newRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores {@code runId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly, since {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** Returns the runId from {@code ctx}, or {@code "unknown"}; never null. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /**
     * Puts {@code runId} into MDC while {@code logAction} runs, then removes it.
     * Only for logging side effects.
     */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
