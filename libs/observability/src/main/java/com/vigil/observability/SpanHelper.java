package com.vigil.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Convenience wrapper around OpenTelemetry {@link Tracer} that attaches the current
 * {@link RunContext} to every span.
 * <p>
 * This helper wraps the OTel API but does NOT configure the SDK. Without an SDK (or agent) the
 * global OpenTelemetry instance is a no-op and spans cost next to nothing.
 */
public final class SpanHelper {

    /** Instrumentation scope name used for the engine's tracer. */
    public static final String INSTRUMENTATION_NAME = "com.vigil.engine";

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
     * Creates a SpanHelper from an OpenTelemetry instance.
     */
    public static SpanHelper from(OpenTelemetry openTelemetry) {
        return new SpanHelper(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * Creates a SpanHelper that records nothing.
     */
    public static SpanHelper noop() {
        return from(OpenTelemetry.noop());
    }

    /**
     * Executes {@code work} within a new internal span. The span is ended automatically; run
     * context attributes are attached from the current {@link RunContextHolder}. A runtime
     * exception marks the span as failed and is rethrown.
     *
     * @param spanName   name for the span
     * @param attributes additional span attributes
     * @param work       the work to execute within the span
     * @param <T>        return type
     * @return the result of the work
     */
    public <T> T withSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();
        RunContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("run.id", ctx.runId());
            if (ctx.checkId() != null) {
                span.setAttribute("check.id", ctx.checkId());
            }
            if (ctx.phase() != null) {
                span.setAttribute("check.phase", ctx.phase());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
