package com.weave.routing;

import static com.weave.routing.Guards.get;
import static com.weave.routing.Guards.path;
import static com.weave.routing.Guards.pathTemplate;
import static com.weave.routing.Guards.requiresAuthentication;
import static com.weave.routing.Responders.setStatus;
import static com.weave.routing.Responders.text;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Router")
class RouterTest {

    private static Request getRequest(String path) {
        return Request.builder(HttpMethod.GET, path).build();
    }

    private static Handler failing(String message) {
        return (exchange, next) -> {
            throw new IllegalStateException(message);
        };
    }

    @Nested
    @DisplayName("dispatch()")
    class Dispatching {

        private final Router router = Router.builder()
                .route(get().then(path("/ping")).then(text("pong")))
                .route(get().then(path("/user")).then(requiresAuthentication(setStatus(401).then(text("Access Denied")))))
                .route(get().then(path("/ping")).then(text("shadowed")))
                .build();

        @Test
        @DisplayName("answers a matched route")
        void matched() {
            Dispatch dispatch = router.dispatch(getRequest("/ping"));

            assertThat(dispatch.disposition()).isEqualTo(Dispatch.Disposition.MATCHED);
            assertThat(dispatch.response().status()).isEqualTo(200);
            assertThat(dispatch.response().bodyAsString()).isEqualTo("pong");
            assertThat(dispatch.response().contentType()).isEqualTo("text/plain; charset=utf-8");
        }

        @Test
        @DisplayName("first registered route wins")
        void firstWins() {
            assertThat(router.route(getRequest("/ping")).bodyAsString()).isEqualTo("pong");
        }

        @Test
        @DisplayName("reports a guard short-circuit as denied")
        void denied() {
            Dispatch dispatch = router.dispatch(getRequest("/user"));

            assertThat(dispatch.disposition()).isEqualTo(Dispatch.Disposition.DENIED);
            assertThat(dispatch.response().status()).isEqualTo(401);
            assertThat(dispatch.response().bodyAsString()).isEqualTo("Access Denied");
        }

        @Test
        @DisplayName("answers 404 Not Found when nothing matches")
        void notFound() {
            Dispatch dispatch = router.dispatch(Request.builder(HttpMethod.DELETE, "/ping").build());

            assertThat(dispatch.disposition()).isEqualTo(Dispatch.Disposition.NOT_FOUND);
            assertThat(dispatch.response().status()).isEqualTo(404);
            assertThat(dispatch.response().bodyAsString()).isEqualTo("Not Found");
        }

        @Test
        @DisplayName("uses a custom not-found handler")
        void customNotFound() {
            Router custom = Router.builder().notFound(setStatus(404).then(text("nothing here"))).build();

            assertThat(custom.route(getRequest("/x")).bodyAsString()).isEqualTo("nothing here");
        }
    }

    @Nested
    @DisplayName("error boundary")
    class ErrorBoundary {

        @Test
        @DisplayName("turns a handler failure into 500 with the failure message")
        void exposesMessage() {
            Router router = Router.builder()
                    .route(get().then(path("/error")).then(failing("Something went wrong!")))
                    .build();

            Dispatch dispatch = router.dispatch(getRequest("/error"));

            assertThat(dispatch.disposition()).isEqualTo(Dispatch.Disposition.FAILED);
            assertThat(dispatch.response().status()).isEqualTo(500);
            assertThat(dispatch.response().bodyAsString()).isEqualTo("Something went wrong!");
        }

        @Test
        @DisplayName("uses an empty body for a failure without message")
        void nullMessage() {
            Router router = Router.builder().route(failing(null)).build();

            Response response = router.route(getRequest("/"));

            assertThat(response.status()).isEqualTo(500);
            assertThat(response.bodyAsString()).isEmpty();
        }

        @Test
        @DisplayName("catches failures raised by a path-template factory")
        void factoryFailure() {
            Router router = Router.builder()
                    .route(pathTemplate("/boom/{id:int}", params -> {
                        throw new IllegalArgumentException("bad id " + params.getInt("id"));
                    }))
                    .build();

            assertThat(router.route(getRequest("/boom/7")).bodyAsString()).isEqualTo("bad id 7");
        }

        @Test
        @DisplayName("falls back to a bare 500 when the error handler fails")
        void errorHandlerFailure() {
            Router router = Router.builder()
                    .route(failing("first"))
                    .errorHandler((failure, request) -> {
                        throw new IllegalStateException("handler broke");
                    })
                    .build();

            Dispatch dispatch = router.dispatch(getRequest("/"));

            assertThat(dispatch.disposition()).isEqualTo(Dispatch.Disposition.FAILED);
            assertThat(dispatch.response().status()).isEqualTo(500);
            assertThat(dispatch.response().body()).isEmpty();
        }

        @Test
        @DisplayName("fixedMessage() hides the failure text")
        void fixedMessage() {
            Router router = Router.builder()
                    .route(failing("secret detail"))
                    .errorHandler(ErrorHandlers.fixedMessage("Internal error"))
                    .build();

            assertThat(router.route(getRequest("/")).bodyAsString()).isEqualTo("Internal error");
        }
    }

    @Test
    @DisplayName("serves concurrent requests without interference")
    void concurrentRequests() throws Exception {
        Router router = Router.builder()
                .route(get().then(pathTemplate("/echo/{n:int}", params -> text("n=" + params.getInt("n")))))
                .build();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> calls = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int n = i;
                calls.add(() -> router.route(getRequest("/echo/" + n)).bodyAsString());
            }
            List<Future<String>> results = executor.invokeAll(calls);
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get()).isEqualTo("n=" + i);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
