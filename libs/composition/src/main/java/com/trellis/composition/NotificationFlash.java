package com.trellis.composition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Carries undelivered notifications to the next request of the same session.
 *
 * <p>Whatever is still queued when a request completes is parked in the session and seeded into
 * the queue of the next request. A redirect always ends up here, having no body to fold a toast
 * into. Entries already delivered never come back.
 */
public final class NotificationFlash {

    private static final Logger log = LoggerFactory.getLogger(NotificationFlash.class);

    private final SessionStore sessions;

    public NotificationFlash(SessionStore sessions) {
        if (sessions == null) {
            throw new IllegalArgumentException("sessions must not be null");
        }
        this.sessions = sessions;
    }

    /** Moves parked entries into a fresh request's queue and clears them from the session. */
    public void restore(String sessionId, NotificationQueue queue) {
        if (sessionId == null) {
            return;
        }
        Optional<Object> stored = sessions.get(sessionId, SessionKeys.FLASH_NOTIFICATIONS);
        if (stored.isEmpty()) {
            return;
        }
        List<Notification> restored = new ArrayList<>();
        if (stored.get() instanceof List<?> parked) {
            for (Object entry : parked) {
                if (entry instanceof Notification notification) {
                    restored.add(notification);
                }
            }
        }
        queue.enqueueAll(restored);
        sessions.remove(sessionId, SessionKeys.FLASH_NOTIFICATIONS);
        log.debug("Restored {} flashed notification(s)", restored.size());
    }

    /** Parks the queue's remaining entries for the next request; no-op when the queue is empty. */
    public void park(String sessionId, NotificationQueue queue) {
        if (sessionId == null || queue.isEmpty()) {
            return;
        }
        List<Notification> pending = new ArrayList<>(queue.drainAll());
        sessions.set(sessionId, SessionKeys.FLASH_NOTIFICATIONS, pending);
        log.debug("Parked {} notification(s) for the next request", pending.size());
    }
}
