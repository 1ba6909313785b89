package com.trellis.composition;

import java.util.List;

/**
 * Thrown when a template is not known to the {@link TemplateCatalog}. Raised while the catalog is
 * built at startup, or when a handler renders a template it never registered.
 */
public class UnknownTemplateException extends IllegalStateException {

    private final List<String> templates;

    public UnknownTemplateException(List<String> templates) {
        super("Unknown template(s): " + String.join(", ", templates));
        this.templates = List.copyOf(templates);
    }

    public List<String> templates() {
        return templates;
    }
}
