package com.trellis.composition;

/**
 * Thrown when the template engine fails to render a template. Fatal for the request: no partial
 * response is ever returned.
 */
public class TemplateRenderException extends RuntimeException {

    private final transient TemplateRef template;

    public TemplateRenderException(TemplateRef template, String message, Throwable cause) {
        super("Failed to render template '%s': %s".formatted(template, message), cause);
        this.template = template;
    }

    public TemplateRef template() {
        return template;
    }
}
