package com.trellis.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that opens one span per rendering step and
 * tags it with the current {@link RequestLogContext}.
 *
 * <p>Does not configure the SDK. The hosting application supplies a tracer (or the no-op one).
 */
public final class CompositionTracer {

    public static final String ATTR_REQUEST_ID = "trellis.request.id";
    public static final String ATTR_USER_ID = "trellis.user.id";
    public static final String ATTR_TENANT_ID = "trellis.tenant.id";
    public static final String ATTR_FRAGMENT = "trellis.fragment";

    private final Tracer tracer;

    /**
     * Creates a tracer wrapper.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public CompositionTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs the given rendering step inside a new internal span. Runtime exceptions are recorded on
     * the span and rethrown unchanged.
     *
     * @param spanName name for the span
     * @param attributes additional span attributes
     * @param step the work to execute within the span
     * @param <T> return type
     * @return the step's result
     */
    public <T> T trace(String spanName, Map<String, String> attributes, Supplier<T> step) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        RequestLogContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_REQUEST_ID, ctx.requestId());
            span.setAttribute(ATTR_FRAGMENT, ctx.fragmentRequest());
            if (ctx.userId() != null) {
                span.setAttribute(ATTR_USER_ID, ctx.userId());
            }
            if (ctx.tenantId() != null) {
                span.setAttribute(ATTR_TENANT_ID, ctx.tenantId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = step.get();
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

    /** Runs the step in a span without extra attributes. */
    public <T> T trace(String spanName, Supplier<T> step) {
        return trace(spanName, Map.of(), step);
    }

    /** Returns the underlying OTel tracer. */
    public Tracer tracer() {
        return tracer;
    }
}
