package com.trellis.composition;

import java.util.Map;

/**
 * Template engine seam. Implementations turn a template and a flat model into markup.
 *
 * <p>Rendering must be deterministic: the same template and model yield the same string.
 */
public interface TemplateRenderer {

    /**
     * Renders a template.
     *
     * @param template the template to render
     * @param model immutable render variables
     * @return rendered markup
     * @throws TemplateRenderException if the engine fails
     */
    String render(TemplateRef template, Map<String, Object> model);

    /**
     * Reports whether the engine can resolve the template. Called once per template when the
     * {@link TemplateCatalog} is built, never on the request path.
     */
    boolean exists(TemplateRef template);
}
