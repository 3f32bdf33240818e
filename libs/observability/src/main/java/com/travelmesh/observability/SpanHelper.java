package com.travelmesh.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the
 * correlation id and the admitted caller of the current hop.
 * <p>
 * The SDK (exporter, sampler, resource) is configured by the deployment, not here; without it
 * the API hands out no-op spans.
 */
public final class SpanHelper {

    /** Span attribute holding the correlation id. */
    public static final String ATTR_CORRELATION_ID = "travelmesh.correlation_id";

    /** Span attribute holding the admitted caller identity. */
    public static final String ATTR_CALLER = "travelmesh.caller";

    /** Span attribute holding the orchestrator-of-record identity. */
    public static final String ATTR_ON_BEHALF_OF = "travelmesh.on_behalf_of";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new internal span and returns its result.
     */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a new span with the given kind and attributes. The span ends when
     * {@code work} returns; an exception marks it as an error and is rethrown unchanged.
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.callerIdentity() != null) {
                span.setAttribute(ATTR_CALLER, ctx.callerIdentity());
            }
            if (ctx.onBehalfOf() != null) {
                span.setAttribute(ATTR_ON_BEHALF_OF, ctx.onBehalfOf());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Adds an attribute to the currently active span, if any. Used to record values only known
     * mid-span (the classified intent, the agent chosen).
     */
    public static void annotateCurrent(String key, String value) {
        if (value != null) {
            Span.current().setAttribute(key, value);
        }
    }

    /** Returns the underlying tracer. */
    public Tracer tracer() {
        return tracer;
    }
}
