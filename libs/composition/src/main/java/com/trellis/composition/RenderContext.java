package com.trellis.composition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable bag of render variables for one request.
 *
 * <p>Created by {@link ViewDispatcher#dispatch(InboundRequest)}, filled by the handler, and read
 * by the renderer through {@link #templateModel(Map)}, which hands templates an immutable snapshot.
 * Never persisted and never shared between requests.
 *
 * <p>The reserved keys below are owned by the composition layer and cannot be set by handlers.
 */
public final class RenderContext {

    /** Name of the shell template page templates decorate themselves with. */
    public static final String BASE_TEMPLATE = "base_template";

    /** Shell name ({@code FULL} or {@code EMPTY}). */
    public static final String SHELL = "shell";

    /** Whether the caller signed in on the previous request. */
    public static final String JUST_LOGGED_IN = "just_logged_in";

    /** Path of the current request. */
    public static final String URL = "url";

    /** True while rendering an out-of-band block. */
    public static final String IS_OOB = "is_oob";

    /** Section the navigation marker highlights. */
    public static final String ACTIVE_SECTION = "active_section";

    /** Notifications delivered by the current response. */
    public static final String NOTIFICATIONS = "notifications";

    private static final Set<String> RESERVED =
            Set.of(BASE_TEMPLATE, SHELL, JUST_LOGGED_IN, URL, IS_OOB, ACTIVE_SECTION, NOTIFICATIONS);

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Shell shell;
    private final boolean justAuthenticated;
    private final String url;
    private String historyUrl;

    public RenderContext(Shell shell, boolean justAuthenticated, String url) {
        if (shell == null) {
            throw new IllegalArgumentException("shell must not be null");
        }
        this.shell = shell;
        this.justAuthenticated = justAuthenticated;
        this.url = url;
    }

    /**
     * Sets a render variable.
     *
     * @throws IllegalArgumentException if the key is reserved or blank
     */
    public RenderContext put(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        if (RESERVED.contains(key)) {
            throw new IllegalArgumentException("'%s' is reserved for the composition layer".formatted(key));
        }
        values.put(key, value);
        return this;
    }

    public RenderContext putAll(Map<String, ?> entries) {
        entries.forEach(this::put);
        return this;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /** Handler-supplied values only, without the reserved keys. */
    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    public Shell shell() {
        return shell;
    }

    public boolean justAuthenticated() {
        return justAuthenticated;
    }

    public Optional<String> url() {
        return Optional.ofNullable(url);
    }

    /** Asks the client to show this URL in the address bar once the response is swapped in. */
    public RenderContext pushHistory(String historyUrl) {
        this.historyUrl = historyUrl;
        return this;
    }

    public Optional<String> historyUrl() {
        return Optional.ofNullable(historyUrl).filter(value -> !value.isBlank());
    }

    /**
     * Snapshot handed to the template engine: handler values, then the reserved keys, then the
     * overlay supplied by the renderer ({@code is_oob}, {@code active_section}, ...).
     */
    public Map<String, Object> templateModel(Map<String, Object> overlay) {
        Map<String, Object> model = new LinkedHashMap<>(values);
        model.put(BASE_TEMPLATE, shell.templateRef().name());
        model.put(SHELL, shell.name());
        model.put(JUST_LOGGED_IN, justAuthenticated);
        model.put(URL, url == null ? "" : url);
        model.put(IS_OOB, false);
        model.putAll(overlay);
        return Collections.unmodifiableMap(model);
    }
}
