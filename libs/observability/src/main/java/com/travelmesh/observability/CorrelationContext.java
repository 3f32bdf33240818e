package com.travelmesh.observability;

/**
 * Immutable correlation context that flows with a single request across hops.
 * <p>
 * Every inbound call (HTTP or gRPC) establishes a {@code CorrelationContext}. The correlation id
 * ties the orchestrator → agent → gateway chain together in logs; the caller identity is the
 * identity the Enforcement Point admitted for this hop, and {@code onBehalfOf} is the
 * orchestrator-of-record when the immediate caller acts for it. All values are copied into SLF4J
 * MDC by {@link CorrelationContextHolder}.
 *
 * @param correlationId  id of the end-to-end business flow (one chat request)
 * @param callerIdentity identity admitted by the Enforcement Point for this hop (nullable before enforcement)
 * @param onBehalfOf     orchestrator-of-record identity (nullable when the caller is the orchestrator itself)
 * @param requestId      id of this specific hop
 * @param spanId         current OpenTelemetry span id (nullable if tracing is not active)
 * @param traceId        current OpenTelemetry trace id (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String callerIdentity,
        String onBehalfOf,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for correlation id. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the admitted caller identity. */
    public static final String MDC_CALLER_IDENTITY = "callerId";

    /** MDC key for the orchestrator-of-record identity. */
    public static final String MDC_ON_BEHALF_OF = "onBehalfOf";

    /** MDC key for request id. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for span id. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for trace id. */
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context carrying only a correlation id, as established by the outermost filter. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null, null);
    }

    /** Returns a copy with the caller admitted by the Enforcement Point. */
    public CorrelationContext withCaller(String caller, String orchestratorOfRecord) {
        return new CorrelationContext(correlationId, caller, orchestratorOfRecord, requestId, spanId, traceId);
    }
}
