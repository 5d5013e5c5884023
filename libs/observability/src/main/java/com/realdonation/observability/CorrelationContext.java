package com.realdonation.observability;

/**
 * Immutable correlation context that flows through a single call into the registry.
 * <p>
 * Every incoming request establishes a {@code CorrelationContext} containing identifiers that
 * tie together log lines, spans and the events the call appends. The values are injected into
 * SLF4J MDC for automatic inclusion in log output.
 *
 * @param correlationId unique ID for the business flow (propagated from the client when supplied)
 * @param callerAddress hex address of the calling account (nullable for anonymous reads)
 * @param requestId     unique ID for this specific request
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String callerAddress,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the caller's address. */
    public static final String MDC_CALLER_ADDRESS = "callerAddress";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for span ID. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    /**
     * Rejects a missing correlationId.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
