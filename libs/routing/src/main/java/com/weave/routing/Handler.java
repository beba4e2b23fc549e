package com.weave.routing;

/**
 * One stage of a pipeline: a guard, a response-head modifier or a terminal responder.
 * <p>
 * A guard either calls {@code next.proceed(exchange)} to pass, returns
 * {@link Outcome#unmatched()} to fall through, or returns {@link Outcome#denied} to stop the
 * search. A responder returns {@link Outcome#matched} and does not call {@code next}.
 * <p>
 * Handlers must not keep per-request state: the same instance serves concurrent requests.
 */
@FunctionalInterface
public interface Handler {

    Outcome handle(Exchange exchange, Next next);

    /** {@code this >=> next}: runs {@code next} only if this handler passes. */
    default Handler then(Handler next) {
        return Handlers.compose(this, next);
    }
}
