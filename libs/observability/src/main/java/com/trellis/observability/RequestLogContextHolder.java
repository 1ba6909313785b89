package com.trellis.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Thread-local holder for {@link RequestLogContext} with SLF4J MDC bridge.
 *
 * <p>While a context is set, the MDC keys {@code requestId}, {@code sessionId}, {@code userId},
 * {@code tenantId} and {@code fragment} are populated, so every log statement issued on the
 * request thread carries them. {@link #clear()} must run when the request completes: servlet
 * containers reuse threads.
 */
public final class RequestLogContextHolder {

    private static final ThreadLocal<RequestLogContext> CONTEXT = new ThreadLocal<>();

    private RequestLogContextHolder() {
        // Utility class, no instantiation
    }

    /**
     * Sets the context for the current thread and populates SLF4J MDC.
     *
     * @param context the context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(RequestLogContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's context, if set. */
    public static Optional<RequestLogContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Replaces the current context with an updated copy. Does nothing when no context is set, so
     * library code can enrich the context without knowing whether a filter opened one.
     *
     * @param update function producing the new context from the current one
     */
    public static void update(UnaryOperator<RequestLogContext> update) {
        RequestLogContext current = CONTEXT.get();
        if (current != null) {
            set(update.apply(current));
        }
    }

    /** Clears the context and removes all MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(RequestLogContext.MDC_REQUEST_ID);
        MDC.remove(RequestLogContext.MDC_SESSION_ID);
        MDC.remove(RequestLogContext.MDC_USER_ID);
        MDC.remove(RequestLogContext.MDC_TENANT_ID);
        MDC.remove(RequestLogContext.MDC_FRAGMENT);
    }

    private static void populateMdc(RequestLogContext ctx) {
        setMdc(RequestLogContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(RequestLogContext.MDC_SESSION_ID, ctx.sessionId());
        setMdc(RequestLogContext.MDC_USER_ID, ctx.userId());
        setMdc(RequestLogContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(RequestLogContext.MDC_FRAGMENT, Boolean.toString(ctx.fragmentRequest()));
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
