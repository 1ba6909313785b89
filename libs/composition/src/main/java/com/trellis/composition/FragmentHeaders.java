package com.trellis.composition;

/** Header names of the fragment-client (htmx) protocol. */
public final class FragmentHeaders {

    /** Request marker; its value is {@link #MARKER_VALUE} on fragment requests. */
    public static final String REQUEST = "HX-Request";

    public static final String MARKER_VALUE = "true";

    /** Id of the element the client will swap the primary fragment into. */
    public static final String TARGET = "HX-Target";

    /** Response instruction: replace the browser address bar without navigating. */
    public static final String PUSH_URL = "HX-Push-Url";

    private FragmentHeaders() {
        // constants
    }
}
