package com.trellis.composition;

/** Severity of a user-facing notification; templates style toasts by {@link #tag()}. */
public enum NotificationLevel {
    SUCCESS("success"),
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String tag;

    NotificationLevel(String tag) {
        this.tag = tag;
    }

    /** Lower-case name used as a CSS hook in templates. */
    public String tag() {
        return tag;
    }
}
