package com.trellis.composition;

/** Thrown when the client went away while a response was being composed. */
public class CompositionCancelledException extends RuntimeException {

    private final String path;

    public CompositionCancelledException(String path) {
        super("Composition of '%s' cancelled: client disconnected".formatted(path));
        this.path = path;
    }

    public String path() {
        return path;
    }
}
