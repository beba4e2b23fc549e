package com.weave.routing;

/**
 * Converts an unhandled failure into a response at the router's error boundary.
 */
@FunctionalInterface
public interface ErrorHandler {

    Response handle(Throwable failure, Request request);
}
