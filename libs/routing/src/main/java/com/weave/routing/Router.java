package com.weave.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered route table with a top-level error boundary.
 * <p>
 * Pipelines are tried in registration order and the first one that does not fall through wins;
 * there is no specificity scoring. If every pipeline falls through, the not-found handler
 * responds. Any {@link RuntimeException} thrown while evaluating is handed to the
 * {@link ErrorHandler}, so a handler failure never escapes {@link #dispatch}.
 * <p>
 * Immutable once built and safe for concurrent use.
 *
 * <pre>
 * Router router = Router.builder()
 *         .route(get().then(path("/ping")).then(text("pong")))
 *         .build();
 * </pre>
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final List<Handler> routes;
    private final Handler notFound;
    private final ErrorHandler errorHandler;

    private Router(Builder builder) {
        this.routes = List.copyOf(builder.routes);
        this.notFound = builder.notFound;
        this.errorHandler = builder.errorHandler;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Routes {@code request} and returns only the response. */
    public Response route(Request request) {
        return dispatch(request).response();
    }

    /** Routes {@code request} and reports how the response was reached. */
    public Dispatch dispatch(Request request) {
        Objects.requireNonNull(request, "request");
        try {
            Exchange exchange = Exchange.of(request);
            for (Handler route : routes) {
                Outcome outcome = route.handle(exchange, Next.END);
                if (outcome instanceof Outcome.Matched matched) {
                    return new Dispatch(matched.response(), Dispatch.Disposition.MATCHED);
                }
                if (outcome instanceof Outcome.Denied denied) {
                    log.debug("Request {} {} denied with status {}",
                            request.method(), request.path(), denied.response().status());
                    return new Dispatch(denied.response(), Dispatch.Disposition.DENIED);
                }
            }
            log.debug("No route matched {} {}", request.method(), request.path());
            Response response = notFound.handle(exchange, Next.END).toResponse()
                    .orElseGet(() -> exchange.withStatus(404).respond(null, new byte[0]));
            return new Dispatch(response, Dispatch.Disposition.NOT_FOUND);
        } catch (RuntimeException e) {
            return new Dispatch(handleFailure(e, request), Dispatch.Disposition.FAILED);
        }
    }

    private Response handleFailure(RuntimeException failure, Request request) {
        try {
            return errorHandler.handle(failure, request);
        } catch (RuntimeException handlerFailure) {
            handlerFailure.addSuppressed(failure);
            log.error("Error handler failed while handling {} {}", request.method(), request.path(), handlerFailure);
            return new Response(500, null, null, null);
        }
    }

    /** Number of registered pipelines. */
    public int size() {
        return routes.size();
    }

    public static final class Builder {

        private final List<Handler> routes = new ArrayList<>();
        private Handler notFound = Responders.setStatus(404).then(Responders.text("Not Found"));
        private ErrorHandler errorHandler = ErrorHandlers.exposeMessage();

        private Builder() {
        }

        /** Appends a pipeline; earlier pipelines take precedence. */
        public Builder route(Handler pipeline) {
            routes.add(Objects.requireNonNull(pipeline, "pipeline"));
            return this;
        }

        public Builder routes(List<Handler> pipelines) {
            pipelines.forEach(this::route);
            return this;
        }

        /** Replaces the default 404 "Not Found" responder. */
        public Builder notFound(Handler handler) {
            this.notFound = Objects.requireNonNull(handler, "handler");
            return this;
        }

        /** Replaces the default {@link ErrorHandlers#exposeMessage()} boundary. */
        public Builder errorHandler(ErrorHandler handler) {
            this.errorHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public Router build() {
            return new Router(this);
        }
    }
}
