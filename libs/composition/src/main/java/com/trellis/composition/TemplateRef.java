package com.trellis.composition;

/**
 * Opaque handle to a template understood by the configured {@link TemplateRenderer}.
 *
 * @param name template name as the renderer resolves it (e.g., {@code teams/dashboard})
 */
public record TemplateRef(String name) {

    public TemplateRef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
