package com.trellis.composition;

/** Thrown when two fragments of one response address the same target id. */
public class DuplicateFragmentTargetException extends IllegalStateException {

    private final String targetId;

    public DuplicateFragmentTargetException(String targetId) {
        super("Fragment target '%s' is declared more than once".formatted(targetId));
        this.targetId = targetId;
    }

    public String targetId() {
        return targetId;
    }
}
