package com.weave.routing;

import com.weave.routing.form.RequestBodies;
import com.weave.security.Principal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An incoming request as seen by guards and responders.
 * <p>
 * Immutable and host-independent: the servlet adapter builds one per call, and tests build them
 * directly through {@link #builder(HttpMethod, String)}. Header names are stored lower-cased.
 *
 * @param method    request method, or null for extension methods no guard knows
 * @param path      decoded request path without query string
 * @param query     raw query string, or null
 * @param headers   lower-cased header name to values
 * @param cookies   cookie name to value
 * @param secure    whether the request arrived over TLS
 * @param principal authenticated principal, or null while anonymous
 * @param body      request body
 */
public record Request(
        HttpMethod method,
        String path,
        String query,
        Map<String, List<String>> headers,
        Map<String, String> cookies,
        boolean secure,
        Principal principal,
        RequestBody body) {

    public Request {
        Objects.requireNonNull(path, "path");
        headers = copyHeaders(headers);
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
        body = body == null ? RequestBodies.empty() : body;
    }

    public static Builder builder(HttpMethod method, String path) {
        return new Builder(method, path);
    }

    /** The authenticated principal, if any. */
    public Optional<Principal> user() {
        return Optional.ofNullable(principal);
    }

    /** First value of the named header (case-insensitive). */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public Optional<String> cookie(String name) {
        return Optional.ofNullable(cookies.get(name));
    }

    /** Copy of this request bound to the given principal. */
    public Request withPrincipal(Principal principal) {
        return new Request(method, path, query, headers, cookies, secure, principal, body);
    }

    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        headers.forEach((name, values) -> copy
                .computeIfAbsent(name.toLowerCase(Locale.ROOT), key -> new ArrayList<>())
                .addAll(values));
        copy.replaceAll((name, values) -> List.copyOf(values));
        return Map.copyOf(copy);
    }

    public static final class Builder {

        private final HttpMethod method;
        private final String path;
        private String query;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private final Map<String, String> cookies = new LinkedHashMap<>();
        private boolean secure;
        private Principal principal;
        private RequestBody body;

        private Builder(HttpMethod method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder header(String name, String value) {
            headers.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder cookie(String name, String value) {
            cookies.put(name, value);
            return this;
        }

        public Builder secure(boolean secure) {
            this.secure = secure;
            return this;
        }

        public Builder principal(Principal principal) {
            this.principal = principal;
            return this;
        }

        public Builder body(RequestBody body) {
            this.body = body;
            return this;
        }

        public Request build() {
            return new Request(method, path, query, headers, cookies, secure, principal, body);
        }
    }
}
