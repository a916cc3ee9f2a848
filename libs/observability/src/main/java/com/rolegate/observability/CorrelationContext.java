package com.rolegate.observability;

/**
 * Immutable correlation context for one guarded call.
 * <p>
 * Established by the adapter that receives the call (HTTP filter, message listener) and
 * copied into SLF4J MDC so that every authentication and decision log line carries it.
 *
 * @param correlationId unique ID for the business flow
 * @param principalId   id of the authenticated principal (null until authentication succeeds)
 * @param requestId     unique ID for this specific request
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String principalId,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for principal ID. */
    public static final String MDC_PRINCIPAL_ID = "principalId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for span ID. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context carrying only a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null);
    }

    /**
     * Returns a copy of this context bound to the given principal.
     */
    public CorrelationContext withPrincipalId(String principalId) {
        return new CorrelationContext(correlationId, principalId, requestId, spanId, traceId);
    }
}
