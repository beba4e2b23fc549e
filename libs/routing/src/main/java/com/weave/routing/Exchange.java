package com.weave.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request evaluation state threaded through a pipeline: the request plus the response head
 * built so far.
 * <p>
 * Every stage that changes the head returns a new instance, so alternatives tried by
 * {@link Handlers#choose} never observe a status or header set by a sibling that fell through.
 *
 * @param request the request being routed
 * @param status  pending response status (200 until a stage changes it)
 * @param headers pending response headers
 */
public record Exchange(Request request, int status, Map<String, List<String>> headers) {

    public Exchange {
        Objects.requireNonNull(request, "request");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        headers = Collections.unmodifiableMap(copy);
    }

    /** Fresh state for {@code request}: status 200, no headers. */
    public static Exchange of(Request request) {
        return new Exchange(request, 200, Map.of());
    }

    public Exchange withStatus(int status) {
        return new Exchange(request, status, headers);
    }

    /** Appends a header value, keeping earlier values of the same header. */
    public Exchange withHeader(String name, String value) {
        Map<String, List<String>> copy = new LinkedHashMap<>(headers);
        List<String> values = new ArrayList<>(copy.getOrDefault(name, List.of()));
        values.add(value);
        copy.put(name, values);
        return new Exchange(request, status, copy);
    }

    /** Completes the pending head with a body. */
    public Response respond(String contentType, byte[] body) {
        return new Response(status, contentType, headers, body);
    }
}
