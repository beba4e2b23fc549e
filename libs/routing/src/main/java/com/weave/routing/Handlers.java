package com.weave.routing;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Combinators that build pipelines out of handlers.
 */
public final class Handlers {

    private Handlers() {
        // utility class
    }

    /**
     * Sequences two handlers: {@code second} runs with whatever exchange {@code first} passes on.
     * If {@code first} falls through or short-circuits, {@code second} never runs.
     */
    public static Handler compose(Handler first, Handler second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        return (exchange, next) -> first.handle(exchange, passed -> second.handle(passed, next));
    }

    /** Sequences handlers left to right. */
    public static Handler compose(Handler first, Handler... rest) {
        Handler pipeline = first;
        for (Handler handler : rest) {
            pipeline = compose(pipeline, handler);
        }
        return pipeline;
    }

    /**
     * Tries each alternative in order with the same incoming exchange and returns the first
     * outcome that is not {@link Outcome.Unmatched}. Falls through if every alternative does.
     */
    public static Handler choose(Handler... alternatives) {
        return choose(List.of(alternatives));
    }

    public static Handler choose(List<Handler> alternatives) {
        List<Handler> ordered = List.copyOf(alternatives);
        return (exchange, next) -> {
            for (Handler alternative : ordered) {
                Outcome outcome = alternative.handle(exchange, next);
                if (!outcome.isUnmatched()) {
                    return outcome;
                }
            }
            return Outcome.unmatched();
        };
    }

    /**
     * Builds the handler anew for every request, so values computed by {@code factory} (such
     * as the current time) are never cached in the route table.
     */
    public static Handler deferred(Function<Request, Handler> factory) {
        Objects.requireNonNull(factory, "factory");
        return (exchange, next) -> factory.apply(exchange.request()).handle(exchange, next);
    }
}
