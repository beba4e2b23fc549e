package com.weave.routing;

import com.weave.security.Principal;
import com.weave.security.RoleChecker;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Guards: stages that either pass the exchange on, fall through, or short-circuit.
 * <p>
 * Structural guards ({@link #method}, {@link #path}, {@link #pathTemplate}) fall through on a
 * mismatch so the next pipeline is tried. Authorization guards short-circuit with a
 * {@link Outcome.Denied} built from their {@code onFail} handler, which stops the search.
 */
public final class Guards {

    private static final int UNAUTHORIZED = 401;

    private Guards() {
        // utility class
    }

    /** Passes only if the request method equals {@code method}. */
    public static Handler method(HttpMethod method) {
        Objects.requireNonNull(method, "method");
        return (exchange, next) -> method == exchange.request().method()
                ? next.proceed(exchange)
                : Outcome.unmatched();
    }

    public static Handler get() {
        return method(HttpMethod.GET);
    }

    public static Handler post() {
        return method(HttpMethod.POST);
    }

    public static Handler put() {
        return method(HttpMethod.PUT);
    }

    public static Handler delete() {
        return method(HttpMethod.DELETE);
    }

    /** Passes only if the request path equals {@code path} exactly (case-sensitive). */
    public static Handler path(String path) {
        Objects.requireNonNull(path, "path");
        return (exchange, next) -> path.equals(exchange.request().path())
                ? next.proceed(exchange)
                : Outcome.unmatched();
    }

    /**
     * Matches the request path against a typed template such as {@code /user/{id:int}} and hands
     * the extracted parameters to {@code handlerFactory}.
     *
     * @throws PathTemplate.InvalidTemplateException if the template does not compile
     */
    public static Handler pathTemplate(String template, Function<PathParameters, Handler> handlerFactory) {
        PathTemplate compiled = PathTemplate.compile(template);
        Objects.requireNonNull(handlerFactory, "handlerFactory");
        return (exchange, next) -> compiled.match(exchange.request().path())
                .map(parameters -> handlerFactory.apply(parameters).handle(exchange, next))
                .orElseGet(Outcome::unmatched);
    }

    /**
     * Passes if the request carries a principal. Otherwise runs {@code onFail} with the pending
     * status set to 401 and denies with its response.
     */
    public static Handler requiresAuthentication(Handler onFail) {
        return authorizeRequest(principal -> principal != null, onFail);
    }

    /** Passes if the principal holds {@code role}. An anonymous request fails the check. */
    public static Handler requiresRole(String role, Handler onFail) {
        Objects.requireNonNull(role, "role");
        return authorizeRequest(principal -> RoleChecker.hasRole(principal, role), onFail);
    }

    /** Passes if the principal holds any of {@code roles}. */
    public static Handler requiresRoleOf(List<String> roles, Handler onFail) {
        String[] required = roles.toArray(new String[0]);
        return authorizeRequest(principal -> RoleChecker.hasAnyRole(principal, required), onFail);
    }

    /**
     * General authorization guard: passes if {@code predicate} accepts the request's principal
     * (null while anonymous), otherwise denies with the response produced by {@code onFail}.
     * <p>
     * {@code onFail} runs against a terminal continuation, so a stage-only handler such as
     * {@code setStatus(403)} still yields a response. If {@code onFail} falls through, the denial
     * carries a bare 401.
     */
    public static Handler authorizeRequest(Predicate<Principal> predicate, Handler onFail) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(onFail, "onFail");
        return (exchange, next) -> predicate.test(exchange.request().principal())
                ? next.proceed(exchange)
                : deny(exchange, onFail);
    }

    private static Outcome deny(Exchange exchange, Handler onFail) {
        Outcome outcome = onFail.handle(exchange.withStatus(UNAUTHORIZED), Next.END);
        return Outcome.denied(outcome.toResponse()
                .orElseGet(() -> exchange.withStatus(UNAUTHORIZED).respond(null, new byte[0])));
    }
}
