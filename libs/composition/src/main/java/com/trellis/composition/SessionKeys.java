package com.trellis.composition;

/** Session keys written and read by the composition layer. */
public final class SessionKeys {

    /** One-shot flag set by the login flow; cleared by the first dispatch that reads it. */
    public static final String JUST_LOGGED_IN = "just_logged_in";

    /** Notifications still queued when the previous request of the session completed. */
    public static final String FLASH_NOTIFICATIONS = "_flash_notifications";

    private SessionKeys() {
        // constants
    }
}
