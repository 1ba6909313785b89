package com.trellis.webshell.infrastructure.web;

import com.trellis.composition.FragmentHeaders;
import com.trellis.composition.InboundRequest;
import com.trellis.composition.NotificationQueue;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

/** Builds {@link InboundRequest}s from servlet requests. */
public final class InboundRequests {

    /** Request attribute holding the request's {@link NotificationQueue}. */
    public static final String NOTIFICATIONS_ATTRIBUTE = InboundRequests.class.getName() + ".notifications";

    private InboundRequests() {
        // Utility class, no instantiation
    }

    public static InboundRequest from(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        InboundRequest.Builder builder = InboundRequest.builder(request.getMethod(), fullPath(request))
                .sessionId(session != null ? session.getId() : null)
                .fragment(isFragment(request))
                .target(request.getHeader(FragmentHeaders.TARGET))
                .notifications(notifications(request))
                .cancellation(() -> Thread.currentThread().isInterrupted());
        request.getParameterMap().forEach((name, values) -> {
            if (values != null && values.length > 0) {
                builder.parameter(name, values[0]);
            }
        });
        return builder.build();
    }

    /** Whether the request carries the htmx marker header. */
    public static boolean isFragment(HttpServletRequest request) {
        return FragmentHeaders.MARKER_VALUE.equals(request.getHeader(FragmentHeaders.REQUEST));
    }

    /** Path plus query string, as the browser requested it. */
    public static String fullPath(HttpServletRequest request) {
        String query = request.getQueryString();
        return query == null || query.isEmpty() ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }

    /** The request's notification queue, created on first use. */
    public static NotificationQueue notifications(HttpServletRequest request) {
        if (request.getAttribute(NOTIFICATIONS_ATTRIBUTE) instanceof NotificationQueue queue) {
            return queue;
        }
        var queue = new NotificationQueue();
        request.setAttribute(NOTIFICATIONS_ATTRIBUTE, queue);
        return queue;
    }
}
