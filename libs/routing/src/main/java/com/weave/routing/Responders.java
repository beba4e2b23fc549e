package com.weave.routing;

import com.weave.routing.form.MediaTypes;
import java.nio.charset.StandardCharsets;

/**
 * Terminal responders and response-head stages.
 */
public final class Responders {

    private Responders() {
        // utility class
    }

    /** Plain UTF-8 text with the pending status and headers. */
    public static Handler text(String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return (exchange, next) -> Outcome.matched(exchange.respond(MediaTypes.TEXT_PLAIN_UTF8, bytes.clone()));
    }

    /** UTF-8 HTML with the pending status and headers. */
    public static Handler html(String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return (exchange, next) -> Outcome.matched(exchange.respond(MediaTypes.TEXT_HTML_UTF8, bytes.clone()));
    }

    /** {@code value} serialized as JSON when the responder runs. */
    public static Handler json(Object value) {
        return (exchange, next) -> Outcome.matched(exchange.respond(MediaTypes.APPLICATION_JSON, Json.write(value)));
    }

    /** Sets the pending status and continues. */
    public static Handler setStatus(int status) {
        return (exchange, next) -> next.proceed(exchange.withStatus(status));
    }

    /** Adds a pending header value and continues. */
    public static Handler setHeader(String name, String value) {
        return (exchange, next) -> next.proceed(exchange.withHeader(name, value));
    }
}
