package com.realdonation.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that runs a unit of work inside an
 * internal span and attaches the current correlation context as span attributes.
 * <p>
 * This helper does NOT configure the SDK; the service provides the tracer at boot time (the no-op
 * tracer is fine when no exporter is configured).
 */
public final class SpanHelper {

    /** Attribute carrying the correlation ID. */
    public static final String ATTR_CORRELATION_ID = "correlation.id";

    /** Attribute carrying the caller's address. */
    public static final String ATTR_CALLER = "caller.address";

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
     * Runs {@code work} inside a new span. Runtime exceptions thrown by the work are recorded on
     * the span, which is marked ERROR, and rethrown unchanged.
     *
     * @param spanName   name for the span (e.g., "registry.donate")
     * @param attributes additional span attributes
     * @param work       the work to execute within the span
     * @param <T>        return type
     * @return the result of the work
     */
    public <T> T traced(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.callerAddress() != null) {
                span.setAttribute(ATTR_CALLER, ctx.callerAddress());
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
     * Void variant of {@link #traced(String, Map, Supplier)}.
     */
    public void traced(String spanName, Map<String, String> attributes, Runnable work) {
        traced(spanName, attributes, () -> {
            work.run();
            return null;
        });
    }
}
