package com.trellis.composition;

/** What the composer does when a response declares the same target id twice. */
public enum DuplicateTargetPolicy {

    /** Throw {@link DuplicateFragmentTargetException}. Default, and the right choice in development. */
    FAIL_FAST,

    /** Log an error and keep the first declaration. */
    FIRST_WINS
}
