package com.trellis.composition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Transport-neutral view of one inbound request, as much of it as response composition needs.
 *
 * <p>The hosting web layer builds one per request. {@code fragmentRequest} is the fragment-client
 * marker the transport derived from the request (the {@code HX-Request} header for htmx); the
 * engine treats it as an opaque boolean.
 *
 * @param sessionId browser session identifier (nullable when the request has no session)
 * @param method HTTP method
 * @param fullPath path including the query string, used for {@code url} and login redirects
 * @param fragmentRequest whether the fragment-client marker was present
 * @param parameters first value of each query/form parameter
 * @param fragmentTarget DOM id the client will swap the primary fragment into (nullable)
 * @param notifications this request's notification queue
 * @param cancellation reports whether the client has gone away
 */
public record InboundRequest(
        String sessionId,
        String method,
        String fullPath,
        boolean fragmentRequest,
        Map<String, String> parameters,
        String fragmentTarget,
        NotificationQueue notifications,
        BooleanSupplier cancellation) {

    public InboundRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be null or blank");
        }
        if (fullPath == null || fullPath.isBlank()) {
            throw new IllegalArgumentException("fullPath must not be null or blank");
        }
        if (notifications == null) {
            throw new IllegalArgumentException("notifications must not be null");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        if (cancellation == null) {
            cancellation = () -> false;
        }
    }

    public static Builder builder(String method, String fullPath) {
        return new Builder(method, fullPath);
    }

    public Optional<String> parameter(String name) {
        return Optional.ofNullable(parameters.get(name)).filter(value -> !value.isBlank());
    }

    public Optional<String> target() {
        return Optional.ofNullable(fragmentTarget).filter(value -> !value.isBlank());
    }

    public boolean cancelled() {
        return cancellation.getAsBoolean();
    }

    public boolean isPost() {
        return "POST".equalsIgnoreCase(method);
    }

    /** Fluent construction for adapters and tests. */
    public static final class Builder {

        private final String method;
        private final String fullPath;
        private String sessionId;
        private boolean fragmentRequest;
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private String fragmentTarget;
        private NotificationQueue notifications = new NotificationQueue();
        private BooleanSupplier cancellation = () -> false;

        private Builder(String method, String fullPath) {
            this.method = method;
            this.fullPath = fullPath;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder fragment(boolean fragmentRequest) {
            this.fragmentRequest = fragmentRequest;
            return this;
        }

        public Builder parameter(String name, String value) {
            parameters.put(name, value);
            return this;
        }

        public Builder target(String fragmentTarget) {
            this.fragmentTarget = fragmentTarget;
            return this;
        }

        public Builder notifications(NotificationQueue notifications) {
            this.notifications = notifications;
            return this;
        }

        public Builder cancellation(BooleanSupplier cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public InboundRequest build() {
            return new InboundRequest(
                    sessionId, method, fullPath, fragmentRequest, parameters, fragmentTarget,
                    notifications, cancellation);
        }
    }
}
