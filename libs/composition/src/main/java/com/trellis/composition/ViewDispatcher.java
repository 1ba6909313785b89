package com.trellis.composition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Opens the {@link RenderContext} for a request and renders single-template pages.
 *
 * <p>Fragment requests get the {@link Shell#EMPTY} shell so the page template emits only its own
 * content; everything else gets {@link Shell#FULL}. A fragment request that asks for a whole page
 * ({@code hx-get=page}) also gets the full shell.
 *
 * <p>The one-shot {@code just_logged_in} session flag is read and removed here, so at most one
 * request ever sees it set, even when that request's response is lost.
 */
public class ViewDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ViewDispatcher.class);

    /** Query parameter that forces the full shell on a fragment request. */
    public static final String SHELL_OVERRIDE_PARAM = "hx-get";

    /** Value of {@link #SHELL_OVERRIDE_PARAM} that forces the full shell. */
    public static final String SHELL_OVERRIDE_PAGE = "page";

    protected final TemplateCatalog catalog;
    protected final SessionStore sessions;

    public ViewDispatcher(TemplateCatalog catalog, SessionStore sessions) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        if (sessions == null) {
            throw new IllegalArgumentException("sessions must not be null");
        }
        this.catalog = catalog;
        this.sessions = sessions;
    }

    /**
     * Chooses the shell and opens the render context for a request.
     *
     * @param request the inbound request
     * @return a fresh context; the handler fills in its values
     */
    public RenderContext dispatch(InboundRequest request) {
        Shell shell = selectShell(request);
        boolean justAuthenticated = consumeJustLoggedIn(request.sessionId());
        log.debug("Dispatching {} {} with {} shell", request.method(), request.fullPath(), shell);
        return new RenderContext(shell, justAuthenticated, request.fullPath());
    }

    /**
     * Renders one template against the context. No out-of-band blocks are added. When the context
     * carries a history URL and the request is a fragment request, the push instruction is set.
     *
     * <p>With the full shell, pending notifications are handed to the template as {@code
     * notifications} and removed from the queue once the page rendered; the shell shows them in its
     * own toast container. With the empty shell they stay queued.
     */
    public ViewResponse render(InboundRequest request, RenderContext context, TemplateRef template) {
        List<Notification> delivered =
                context.shell() == Shell.FULL ? request.notifications().peekAll() : List.of();
        String body = catalog.render(template, context.templateModel(Map.of(RenderContext.NOTIFICATIONS, delivered)));
        request.notifications().acknowledge(delivered.size());
        ViewResponse response = ViewResponse.html(body);
        if (request.fragmentRequest() && context.historyUrl().isPresent()) {
            response = response.withHeader(FragmentHeaders.PUSH_URL, context.historyUrl().get());
        }
        return response;
    }

    public TemplateCatalog catalog() {
        return catalog;
    }

    private Shell selectShell(InboundRequest request) {
        if (!request.fragmentRequest()) {
            return Shell.FULL;
        }
        boolean wholePage = request.parameter(SHELL_OVERRIDE_PARAM)
                .map(SHELL_OVERRIDE_PAGE::equals)
                .orElse(false);
        return wholePage ? Shell.FULL : Shell.EMPTY;
    }

    private boolean consumeJustLoggedIn(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        Optional<Object> stored = sessions.get(sessionId, SessionKeys.JUST_LOGGED_IN);
        if (stored.isEmpty()) {
            return false;
        }
        sessions.remove(sessionId, SessionKeys.JUST_LOGGED_IN);
        return Boolean.TRUE.equals(stored.get());
    }
}
