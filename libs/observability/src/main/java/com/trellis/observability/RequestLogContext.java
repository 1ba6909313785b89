package com.trellis.observability;

/**
 * Immutable identifiers attached to every log line and span produced while one inbound request is
 * being rendered.
 *
 * <p>The servlet filter opens a context with the request and session identifiers; the caller and
 * the resolved team are added later in the request via {@link #withUser(String)} and {@link
 * #withTenant(String)}, which return updated copies.
 *
 * @param requestId unique ID for this request (propagated from {@code X-Request-ID} or generated)
 * @param sessionId browser session identifier (nullable before a session exists)
 * @param userId authenticated caller (nullable for anonymous requests)
 * @param tenantId active team after tenant resolution (nullable until resolved)
 * @param fragmentRequest whether the request carried the fragment-client marker
 */
public record RequestLogContext(
        String requestId, String sessionId, String userId, String tenantId, boolean fragmentRequest) {

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for session ID. */
    public static final String MDC_SESSION_ID = "sessionId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the fragment marker ("true"/"false"). */
    public static final String MDC_FRAGMENT = "fragment";

    /** Compact constructor: ensures requestId is never null. */
    public RequestLogContext {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
    }

    /** Opens a context for a request whose caller and team are not known yet. */
    public static RequestLogContext open(String requestId, String sessionId, boolean fragmentRequest) {
        return new RequestLogContext(requestId, sessionId, null, null, fragmentRequest);
    }

    public RequestLogContext withUser(String userId) {
        return new RequestLogContext(requestId, sessionId, userId, tenantId, fragmentRequest);
    }

    public RequestLogContext withTenant(String tenantId) {
        return new RequestLogContext(requestId, sessionId, userId, tenantId, fragmentRequest);
    }
}
