package com.weave.routing;

import com.weave.routing.form.MediaTypes;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stock {@link ErrorHandler}s.
 */
public final class ErrorHandlers {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandlers.class);

    static final String UNHANDLED_MESSAGE = "An unhandled exception has occurred while executing the request.";

    private ErrorHandlers() {
        // utility class
    }

    /**
     * Logs the failure at ERROR and answers 500 with the failure's message as plain text.
     * <p>
     * Not for hosts whose exception messages may carry internal details.
     */
    public static ErrorHandler exposeMessage() {
        return (failure, request) -> {
            log.error(UNHANDLED_MESSAGE, failure);
            String message = Objects.toString(failure.getMessage(), "");
            return Response.of(500, MediaTypes.TEXT_PLAIN_UTF8, message);
        };
    }

    /** Logs the failure and answers 500 with a fixed body. */
    public static ErrorHandler fixedMessage(String body) {
        Objects.requireNonNull(body, "body");
        return (failure, request) -> {
            log.error(UNHANDLED_MESSAGE, failure);
            return Response.of(500, MediaTypes.TEXT_PLAIN_UTF8, body);
        };
    }
}
