package com.registrygateway.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a per-request trace id through gateway pipelines.
 *
 * <p>The Reactor Context is the only place the id lives while a request is in flight;
 * MDC is written just for the duration of a single log statement via {@link #withMdc}.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(gatewayService.searchBusiness(query), traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /** Stores {@code traceId} in the pipeline's Reactor Context. Call at the end of assembly. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Returns the trace id from {@code ctx}, or {@code "unknown"} when none was written. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** Uses {@code candidate} when non-blank, otherwise mints a random id. */
    public static String resolveTraceId(String candidate) {
        return candidate == null || candidate.isBlank() ? UUID.randomUUID().toString() : candidate;
    }

    /**
     * Puts {@code traceId} into MDC while {@code logAction} runs, then removes it.
     * Only for logging side-effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
