package com.trellis.composition;

/**
 * Document wrapper a page template is rendered into.
 *
 * <p>Page templates decorate themselves with the template named by the {@code base_template}
 * model key, so choosing the shell is a matter of choosing that name.
 */
public enum Shell {

    /** Complete HTML document: head, navigation, toast and modal containers. */
    FULL("layout/base"),

    /** Pass-through wrapper for fragment requests; emits only the page's own content. */
    EMPTY("layout/partial");

    private final TemplateRef templateRef;

    Shell(String templateName) {
        this.templateRef = new TemplateRef(templateName);
    }

    /** The shell template that page templates decorate themselves with. */
    public TemplateRef templateRef() {
        return templateRef;
    }
}
