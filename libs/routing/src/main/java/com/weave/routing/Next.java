package com.weave.routing;

/**
 * Continuation to the rest of a pipeline.
 */
@FunctionalInterface
public interface Next {

    /** End of every pipeline: the pending head becomes the response, with an empty body. */
    Next END = exchange -> Outcome.matched(exchange.respond(null, new byte[0]));

    Outcome proceed(Exchange exchange);
}
