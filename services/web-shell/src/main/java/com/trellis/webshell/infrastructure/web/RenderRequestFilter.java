package com.trellis.webshell.infrastructure.web;

import com.trellis.composition.NotificationFlash;
import com.trellis.composition.NotificationQueue;
import com.trellis.observability.RequestLogContext;
import com.trellis.observability.RequestLogContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Opens the per-request state every rendered response relies on.
 *
 * <ol>
 *   <li>request id: propagated from {@code X-Request-ID} or generated, echoed on the response
 *   <li>{@link RequestLogContextHolder}: request, session and fragment marker in the MDC
 *   <li>the request's {@link NotificationQueue}, seeded with entries flashed by the previous
 *       request of the session
 * </ol>
 *
 * <p>Whatever is still queued when the request completes is flashed to the session, which is how
 * notifications raised before a redirect reach the page the browser lands on.
 *
 * <p>Ordered right after Spring's {@code RequestContextFilter} so the session store can reach the
 * current session.
 */
@Component
@Order(RenderRequestFilter.ORDER)
public class RenderRequestFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    /** One step after {@code OrderedRequestContextFilter} (-105). */
    public static final int ORDER = -104;

    private final NotificationFlash flash;

    public RenderRequestFilter(NotificationFlash flash) {
        this.flash = flash;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        String sessionId = sessionId(request);
        RequestLogContextHolder.set(RequestLogContext.open(requestId, sessionId, InboundRequests.isFragment(request)));
        response.setHeader(REQUEST_ID_HEADER, requestId);

        NotificationQueue notifications = InboundRequests.notifications(request);
        flash.restore(sessionId, notifications);
        try {
            filterChain.doFilter(request, response);
        } finally {
            flash.park(sessionId(request), notifications);
            RequestLogContextHolder.clear();
        }
    }

    private static String sessionId(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        return session != null ? session.getId() : null;
    }
}
