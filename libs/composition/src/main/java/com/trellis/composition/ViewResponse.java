package com.trellis.composition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fully assembled response, ready to be written by the hosting web layer in one go.
 *
 * @param status HTTP status code
 * @param body complete response body (empty for redirects)
 * @param contentType content type header value
 * @param headers extra response headers in insertion order
 * @param oobTargets target ids of the out-of-band blocks in the body, in body order
 */
public record ViewResponse(
        int status, String body, String contentType, Map<String, String> headers, List<String> oobTargets) {

    public static final String TEXT_HTML = "text/html;charset=UTF-8";
    public static final String LOCATION = "Location";

    public ViewResponse {
        body = body == null ? "" : body;
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers == null ? Map.of() : headers));
        oobTargets = oobTargets == null ? List.of() : List.copyOf(oobTargets);
    }

    /** A 200 HTML response without out-of-band blocks. */
    public static ViewResponse html(String body) {
        return new ViewResponse(200, body, TEXT_HTML, Map.of(), List.of());
    }

    /** A 200 HTML response whose body carries the given out-of-band blocks. */
    public static ViewResponse fragments(String body, List<String> oobTargets) {
        return new ViewResponse(200, body, TEXT_HTML, Map.of(), oobTargets);
    }

    /** A {@code 302 Found} redirect. */
    public static ViewResponse redirect(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location must not be null or blank");
        }
        return new ViewResponse(302, "", TEXT_HTML, Map.of(LOCATION, location), List.of());
    }

    /** Copy with the header added or replaced. */
    public ViewResponse withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ViewResponse(status, body, contentType, copy, oobTargets);
    }

    /** Copy with another status code. */
    public ViewResponse withStatus(int newStatus) {
        return new ViewResponse(newStatus, body, contentType, headers, oobTargets);
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public boolean isRedirect() {
        return status >= 300 && status < 400;
    }
}
