package com.rolegate.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} for asynchronous work.
 * <p>
 * The span starts when the work is submitted and ends when its future completes, so the
 * span covers the whole authentication round trip rather than only the submission. This
 * class does not configure the SDK; services configure exporters and samplers at boot.
 */
public final class SpanHelper {

    /** Instrumentation scope name used by {@link #noop()}. */
    public static final String INSTRUMENTATION_NAME = "com.rolegate";

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Creates a helper whose spans are discarded.
     */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * Runs asynchronous work inside a new span.
     * <p>
     * The supplier is invoked with the span current. The span is ended when the returned
     * future completes; an exceptional completion marks the span as an error, a
     * cancellation is recorded as an event. Correlation attributes are copied from
     * {@link CorrelationContextHolder} at submission time.
     *
     * @param spanName   name for the span
     * @param attributes additional span attributes
     * @param work       supplies the future to trace
     * @param <T>        result type
     * @return the future produced by {@code work}, or a failed future if it produced none
     */
    public <T> CompletableFuture<T> traceAsync(String spanName, Map<String, String> attributes,
                                               Supplier<CompletableFuture<T>> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.requestId() != null) {
                span.setAttribute("request.id", ctx.requestId());
            }
        });

        CompletableFuture<T> future;
        try (Scope ignored = span.makeCurrent()) {
            future = work.get();
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            span.end();
            throw e;
        }
        if (future == null) {
            span.setStatus(StatusCode.ERROR, "no future returned");
            span.end();
            return CompletableFuture.failedFuture(
                    new IllegalStateException("traced work for '" + spanName + "' returned no future"));
        }

        future.whenComplete((result, error) -> {
            if (error == null) {
                span.setStatus(StatusCode.OK);
            } else {
                Throwable cause = unwrap(error);
                if (cause instanceof CancellationException) {
                    span.addEvent("cancelled");
                } else {
                    span.setStatus(StatusCode.ERROR, String.valueOf(cause.getMessage()));
                    span.recordException(cause);
                }
            }
            span.end();
        });
        return future;
    }

    public Tracer tracer() {
        return tracer;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
