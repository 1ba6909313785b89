package com.trellis.composition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The set of templates an application may render, verified against the engine once at startup.
 *
 * <p>Endpoints obtain their {@link TemplateRef}s through {@link #ref(String)} when they are
 * constructed, so a missing template stops the application from starting instead of failing the
 * first request that needs it. The shell templates and the templates the {@link FragmentComposer}
 * synthesizes are always registered.
 */
public final class TemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

    /** Toast container template, rendered with the drained notifications. */
    public static final TemplateRef TOASTS = new TemplateRef("layout/messages/toast");

    /** Navigation marker template, rendered with {@code active_section}. */
    public static final TemplateRef ACTIVE_NAV = new TemplateRef("layout/nav/active_nav");

    /** Modal container template. */
    public static final TemplateRef MODALS = new TemplateRef("layout/modals/modal_container");

    private final TemplateRenderer renderer;
    private final Set<TemplateRef> templates;

    private TemplateCatalog(TemplateRenderer renderer, Set<TemplateRef> templates) {
        this.renderer = renderer;
        this.templates = Collections.unmodifiableSet(templates);
    }

    /** Starts a catalog backed by the given renderer. */
    public static Builder builder(TemplateRenderer renderer) {
        return new Builder(renderer);
    }

    /**
     * Returns the handle for a registered template.
     *
     * @throws UnknownTemplateException if the template was not registered
     */
    public TemplateRef ref(String name) {
        TemplateRef ref = new TemplateRef(name);
        requireRegistered(ref);
        return ref;
    }

    public boolean contains(TemplateRef template) {
        return templates.contains(template);
    }

    /** All registered templates, in registration order. */
    public Set<TemplateRef> templates() {
        return templates;
    }

    /**
     * Renders a registered template. Engine failures surface as {@link TemplateRenderException}.
     *
     * @throws UnknownTemplateException if the template was not registered
     */
    public String render(TemplateRef template, Map<String, Object> model) {
        requireRegistered(template);
        try {
            return renderer.render(template, model);
        } catch (TemplateRenderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TemplateRenderException(template, e.getMessage(), e);
        }
    }

    private void requireRegistered(TemplateRef template) {
        if (!templates.contains(template)) {
            throw new UnknownTemplateException(List.of(template.name()));
        }
    }

    /** Collects template names and verifies them when built. */
    public static final class Builder {

        private final TemplateRenderer renderer;
        private final Set<TemplateRef> templates = new LinkedHashSet<>();

        private Builder(TemplateRenderer renderer) {
            if (renderer == null) {
                throw new IllegalArgumentException("renderer must not be null");
            }
            this.renderer = renderer;
            for (Shell shell : Shell.values()) {
                templates.add(shell.templateRef());
            }
            templates.add(TOASTS);
            templates.add(ACTIVE_NAV);
            templates.add(MODALS);
        }

        public Builder register(String... names) {
            for (String name : names) {
                templates.add(new TemplateRef(name));
            }
            return this;
        }

        public Builder register(TemplateRef template) {
            templates.add(template);
            return this;
        }

        /**
         * Verifies every registered template with the renderer.
         *
         * @throws UnknownTemplateException listing every template the renderer cannot resolve
         */
        public TemplateCatalog build() {
            List<String> missing = new ArrayList<>();
            for (TemplateRef template : templates) {
                if (!renderer.exists(template)) {
                    missing.add(template.name());
                }
            }
            if (!missing.isEmpty()) {
                throw new UnknownTemplateException(missing);
            }
            log.info("Template catalog verified: {} templates", templates.size());
            return new TemplateCatalog(renderer, new LinkedHashSet<>(templates));
        }
    }
}
