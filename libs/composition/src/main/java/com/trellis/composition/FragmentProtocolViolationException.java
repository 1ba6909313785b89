package com.trellis.composition;

/**
 * Thrown when a fragment-only endpoint is reached without the fragment-client marker. Points at a
 * misconfigured link or form, so it is a server error rather than a user error.
 */
public class FragmentProtocolViolationException extends RuntimeException {

    private final String path;

    public FragmentProtocolViolationException(String path) {
        super("Endpoint '%s' is only reachable through fragment requests".formatted(path));
        this.path = path;
    }

    public String path() {
        return path;
    }
}
