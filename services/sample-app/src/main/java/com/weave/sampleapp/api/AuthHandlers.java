package com.weave.sampleapp.api;

import com.weave.routing.Handler;
import com.weave.routing.Handlers;
import com.weave.routing.Responders;
import com.weave.sampleapp.infrastructure.web.SessionCookies;
import com.weave.security.Claim;
import com.weave.security.ClaimTypes;
import com.weave.security.Principal;
import com.weave.security.Session;
import com.weave.security.SessionOptions;
import com.weave.security.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

/**
 * Cookie sign-in and sign-out stages.
 *
 * <p>Login asserts a fixed demonstration identity without checking credentials.
 */
public class AuthHandlers {

    private static final Logger log = LoggerFactory.getLogger(AuthHandlers.class);

    private final SessionStore sessionStore;
    private final SessionOptions options;
    private final Clock clock;
    private final String issuer;

    public AuthHandlers(SessionStore sessionStore, SessionOptions options, Clock clock, String issuer) {
        this.sessionStore = sessionStore;
        this.options = options;
        this.clock = clock;
        this.issuer = issuer;
    }

    /** Principal issued by {@link #login()}: John Doe in the Admin role. */
    public Principal demoPrincipal() {
        return new Principal(options.authenticationScheme(), List.of(
                Claim.of(ClaimTypes.NAME, "John", issuer),
                Claim.of(ClaimTypes.SURNAME, "Doe", issuer),
                Claim.of(ClaimTypes.ROLE, "Admin", issuer)));
    }

    /** Signs in {@link #demoPrincipal()} and appends the session cookie. */
    public Handler login() {
        return (exchange, next) -> {
            Instant now = clock.instant();
            Session session = sessionStore.signIn(demoPrincipal(), now);
            log.info("Signed in {}", session.principal().name());
            String cookie = SessionCookies.issue(options, session, exchange.request().secure(), now);
            return next.proceed(exchange.withHeader(HttpHeaders.SET_COOKIE, cookie));
        };
    }

    /** Ends the session named by the request's cookie, if any, and expires the cookie. */
    public Handler logout() {
        return (exchange, next) -> {
            exchange.request().cookie(options.cookieName()).ifPresent(sessionStore::signOut);
            exchange.request().user().ifPresent(principal -> log.info("Signed out {}", principal.name()));
            String cookie = SessionCookies.expire(options, exchange.request().secure());
            return next.proceed(exchange.withHeader(HttpHeaders.SET_COOKIE, cookie));
        };
    }

    /** Responds with the signed-in principal's name. Place behind an authentication guard. */
    public Handler showUser() {
        return Handlers.deferred(request -> Responders.text(request.user().map(Principal::name).orElse("")));
    }
}
