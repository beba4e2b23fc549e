package com.weave.routing;

import java.util.Locale;
import java.util.Objects;

/**
 * What the router did with a request: the response plus how it was reached.
 *
 * @param response    response to send
 * @param disposition which branch of the router produced it
 */
public record Dispatch(Response response, Disposition disposition) {

    public Dispatch {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(disposition, "disposition");
    }

    public enum Disposition {
        /** A pipeline matched and responded. */
        MATCHED,
        /** A guard short-circuited. */
        DENIED,
        /** No pipeline matched; the not-found handler responded. */
        NOT_FOUND,
        /** A handler threw; the error handler responded. */
        FAILED;

        /** Lower-case name, used as a metric tag value. */
        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
