package com.pmatrix.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Trace-id plumbing for the encoder's reactive request handling.
 *
 * <p>The Reactor Context holds the trace id for the lifetime of a request.
 * MDC is written only while a single log statement runs, then cleared.
 *
 * <pre>
 *     String traceId = TraceContextUtil.resolve(headerValue);
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Returns the caller-supplied trace id, or a fresh one when none was sent. */
    public static String resolve(String supplied) {
        if (supplied == null || supplied.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return supplied.trim();
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Never null; {@code "unknown"} when the context carries no trace id. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with {@code traceId} bound in MDC, removing it afterwards.
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
