package com.trellis.webshell.infrastructure.web;

import com.trellis.composition.SessionStore;
import jakarta.servlet.http.HttpSession;
import jakarta.servlet.http.HttpSessionEvent;
import jakarta.servlet.http.HttpSessionIdListener;
import jakarta.servlet.http.HttpSessionListener;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * {@link SessionStore} over servlet {@link HttpSession}s.
 *
 * <p>The session of the request bound to the current thread is used directly when its id matches.
 * Other live sessions are found through the ids this listener tracks. Attribute writes replace the
 * whole value.
 */
public class ServletSessionStore implements SessionStore, HttpSessionListener, HttpSessionIdListener {

    private static final Logger log = LoggerFactory.getLogger(ServletSessionStore.class);

    private final Map<String, HttpSession> live = new ConcurrentHashMap<>();

    @Override
    public Optional<Object> get(String sessionId, String key) {
        return session(sessionId).flatMap(session -> {
            try {
                return Optional.ofNullable(session.getAttribute(key));
            } catch (IllegalStateException e) {
                log.debug("Session {} was invalidated while reading {}", sessionId, key);
                return Optional.empty();
            }
        });
    }

    @Override
    public void set(String sessionId, String key, Object value) {
        HttpSession session = session(sessionId)
                .orElseThrow(() -> new IllegalStateException("No live session " + sessionId));
        session.setAttribute(key, value);
    }

    @Override
    public void remove(String sessionId, String key) {
        session(sessionId).ifPresent(session -> {
            try {
                session.removeAttribute(key);
            } catch (IllegalStateException e) {
                log.debug("Session {} was invalidated while removing {}", sessionId, key);
            }
        });
    }

    @Override
    public void sessionCreated(HttpSessionEvent event) {
        live.put(event.getSession().getId(), event.getSession());
    }

    @Override
    public void sessionDestroyed(HttpSessionEvent event) {
        live.remove(event.getSession().getId());
    }

    @Override
    public void sessionIdChanged(HttpSessionEvent event, String oldSessionId) {
        live.remove(oldSessionId);
        live.put(event.getSession().getId(), event.getSession());
    }

    /** Number of sessions the listener currently tracks. */
    public int liveSessions() {
        return live.size();
    }

    private Optional<HttpSession> session(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        HttpSession current = currentRequestSession();
        if (current != null && sessionId.equals(current.getId())) {
            return Optional.of(current);
        }
        return Optional.ofNullable(live.get(sessionId));
    }

    private static HttpSession currentRequestSession() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes servlet) {
            return servlet.getRequest().getSession(false);
        }
        return null;
    }
}
