package com.weave.routing;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A finished response: status, content type, headers and body.
 *
 * @param status      HTTP status code
 * @param contentType value of the Content-Type header, or null for an empty body
 * @param headers     additional headers (multi-valued, e.g. several Set-Cookie lines)
 * @param body        body bytes, never null; copied on the way in and out
 */
public record Response(int status, String contentType, Map<String, List<String>> headers, byte[] body) {

    public Response {
        if (status < 100 || status > 999) {
            throw new IllegalArgumentException("status must be a three-digit code: " + status);
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    /** A response with a UTF-8 text body and no extra headers. */
    public static Response of(int status, String contentType, String body) {
        return new Response(status, contentType, Map.of(), body.getBytes(StandardCharsets.UTF_8));
    }

    /** The body decoded as UTF-8. */
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /** First value of the named header (case-insensitive). */
    public Optional<String> header(String name) {
        return headerValues(name).stream().findFirst();
    }

    /** All values of the named header (case-insensitive). */
    public List<String> headerValues(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Response other)) {
            return false;
        }
        return status == other.status
                && Objects.equals(contentType, other.contentType)
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(status, contentType, headers) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "Response[status=" + status + ", contentType=" + contentType + ", headers=" + headers
                + ", body=" + body.length + " bytes]";
    }
}
