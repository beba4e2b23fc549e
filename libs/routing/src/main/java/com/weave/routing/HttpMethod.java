package com.weave.routing;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP request methods understood by the method guards.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS;

    /**
     * Looks up a method by name, ignoring case.
     *
     * @param value method token from the request line (may be null)
     * @return the matching method, or empty for extension methods
     */
    public static Optional<HttpMethod> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String upper = value.toUpperCase(Locale.ROOT);
        for (HttpMethod method : values()) {
            if (method.name().equals(upper)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
