package com.weave.routing;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of evaluating a handler against a request.
 * <p>
 * {@link Unmatched} means "this pipeline does not apply, try the next one". {@link Matched} and
 * {@link Denied} both end the search: the first is a normal response, the second a deliberate
 * short-circuit by a guard.
 */
public sealed interface Outcome permits Outcome.Matched, Outcome.Unmatched, Outcome.Denied {

    /** The pipeline applied and produced a response. */
    record Matched(Response response) implements Outcome {
        public Matched {
            Objects.requireNonNull(response, "response");
        }
    }

    /** The pipeline does not apply to the request. */
    record Unmatched() implements Outcome {
    }

    /** A guard stopped evaluation with this response. */
    record Denied(Response response) implements Outcome {
        public Denied {
            Objects.requireNonNull(response, "response");
        }
    }

    Unmatched UNMATCHED = new Unmatched();

    static Outcome matched(Response response) {
        return new Matched(response);
    }

    static Outcome unmatched() {
        return UNMATCHED;
    }

    static Outcome denied(Response response) {
        return new Denied(response);
    }

    default boolean isUnmatched() {
        return this instanceof Unmatched;
    }

    /** The response carried by a Matched or Denied outcome. */
    default Optional<Response> toResponse() {
        if (this instanceof Matched matched) {
            return Optional.of(matched.response());
        }
        if (this instanceof Denied denied) {
            return Optional.of(denied.response());
        }
        return Optional.empty();
    }
}
