package com.trustgate.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;
import reactor.util.context.ContextView;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Trace and room correlation for log lines.
 *
 * <p>Inside reactive pipelines the Reactor Context carries the trace id. MDC is only written as
 * a temporary bridge around a block of work and always cleared afterwards, because timer fires
 * and execute callbacks hop between pooled threads.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(
 *         pipeline.doOnEach(TraceContextUtil.onNextWithMdc((value, traceId) -> log.info(...))),
 *         traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY      = "traceId";
    public static final String ROOM_KEY          = "room";
    public static final String PREDICTION_ID_KEY = "predictionId";

    private TraceContextUtil() {}

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Returns {@code "unknown"} when no trace id was written. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    public static void withMdc(String traceId, Runnable action) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            action.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }

    /**
     * {@code doOnEach} consumer that hands each emitted value to {@code action} with the trace id
     * read from the signal's context and bridged into MDC for the duration of the call.
     * Error and completion signals are ignored.
     */
    public static <T> Consumer<Signal<T>> onNextWithMdc(BiConsumer<T, String> action) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = getTraceId(signal.getContextView());
            withMdc(traceId, () -> action.accept(signal.get(), traceId));
        };
    }

    /** Runs {@code action} with the room and prediction id bridged into MDC. */
    public static void withPredictionMdc(String room, String predictionId, Runnable action) {
        MDC.put(ROOM_KEY, room);
        MDC.put(PREDICTION_ID_KEY, predictionId);
        try {
            action.run();
        } finally {
            MDC.remove(ROOM_KEY);
            MDC.remove(PREDICTION_ID_KEY);
        }
    }
}
