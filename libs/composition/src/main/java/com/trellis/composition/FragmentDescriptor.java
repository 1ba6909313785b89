package com.trellis.composition;

import java.util.regex.Pattern;

/**
 * One block of a fragment response.
 *
 * <p>The primary block is emitted as rendered and lands wherever the client targeted the request.
 * Secondary blocks are marked for out-of-band swapping into the element whose id is {@code
 * targetId}.
 *
 * @param targetId DOM id the block replaces
 * @param templateRef template rendering the block
 * @param primary whether this is the response's primary block
 */
public record FragmentDescriptor(String targetId, TemplateRef templateRef, boolean primary) {

    /** Target assumed for the primary block when the client did not name one. */
    public static final String DEFAULT_PRIMARY_TARGET = "main-content";

    private static final Pattern DOM_ID = Pattern.compile("[A-Za-z][A-Za-z0-9_:.-]*");

    public FragmentDescriptor {
        if (targetId == null || !DOM_ID.matcher(targetId).matches()) {
            throw new IllegalArgumentException("targetId must be a valid element id, was '%s'".formatted(targetId));
        }
        if (templateRef == null) {
            throw new IllegalArgumentException("templateRef must not be null");
        }
    }

    public static FragmentDescriptor primary(TemplateRef templateRef) {
        return new FragmentDescriptor(DEFAULT_PRIMARY_TARGET, templateRef, true);
    }

    public static FragmentDescriptor primary(String targetId, TemplateRef templateRef) {
        return new FragmentDescriptor(targetId, templateRef, true);
    }

    public static FragmentDescriptor secondary(String targetId, TemplateRef templateRef) {
        return new FragmentDescriptor(targetId, templateRef, false);
    }
}
