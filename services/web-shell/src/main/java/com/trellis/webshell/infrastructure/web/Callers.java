package com.trellis.webshell.infrastructure.web;

import com.trellis.composition.InboundRequest;
import com.trellis.composition.SessionKeys;
import com.trellis.composition.ViewResponse;
import com.trellis.tenancy.AuthenticatedUser;
import com.trellis.webshell.config.WebShellProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the signed-in caller from the session. Authentication itself happens elsewhere; whatever
 * signs a user in stores an {@link AuthenticatedUser} under {@value #SESSION_ATTRIBUTE}.
 */
@Component
public class Callers {

    private static final Logger log = LoggerFactory.getLogger(Callers.class);

    public static final String SESSION_ATTRIBUTE = "authenticated_user";

    private final WebShellProperties properties;

    public Callers(WebShellProperties properties) {
        this.properties = properties;
    }

    public Optional<AuthenticatedUser> current(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        return session.getAttribute(SESSION_ATTRIBUTE) instanceof AuthenticatedUser user
                ? Optional.of(user)
                : Optional.empty();
    }

    /** Redirect to the login page that comes back to the requested path afterwards. */
    public ViewResponse loginRedirect(InboundRequest request) {
        String next = URLEncoder.encode(request.fullPath(), StandardCharsets.UTF_8);
        return ViewResponse.redirect(properties.loginPath() + "?next=" + next);
    }

    /**
     * Stores the caller in a fresh session id and raises the one-shot {@code just_logged_in} flag
     * for the next rendered page.
     */
    public void signIn(HttpServletRequest request, AuthenticatedUser user) {
        HttpSession session = request.getSession(true);
        request.changeSessionId();
        session.setAttribute(SESSION_ATTRIBUTE, user);
        session.setAttribute(SessionKeys.JUST_LOGGED_IN, true);
        log.info("User {} signed in", user.userId());
    }

    public void signOut(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.invalidate();
        }
    }
}
