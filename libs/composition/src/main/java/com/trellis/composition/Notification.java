package com.trellis.composition;

import java.io.Serializable;

/**
 * One queued user-facing message. Serializable so undelivered entries can ride the session across
 * a redirect.
 *
 * @param level severity
 * @param text message shown to the user
 */
public record Notification(NotificationLevel level, String text) implements Serializable {

    public Notification {
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be null or blank");
        }
    }

    /** Convenience for templates: the level's CSS tag. */
    public String tags() {
        return level.tag();
    }
}
