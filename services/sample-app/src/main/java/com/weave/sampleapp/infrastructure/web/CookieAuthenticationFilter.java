package com.weave.sampleapp.infrastructure.web;

import com.weave.observability.CorrelationContextHolder;
import com.weave.security.Principal;
import com.weave.security.Session;
import com.weave.security.SessionOptions;
import com.weave.security.SessionStore;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the session cookie into a {@link Principal}.
 *
 * <p>A live session's principal is stored under {@link #PRINCIPAL_ATTRIBUTE} for the router and
 * its name is added to the correlation context. When sliding expiration renewed the session, the
 * cookie is re-sent with the new lifetime. Requests without a live session pass through
 * anonymously; rejecting them is the job of the route guards.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CookieAuthenticationFilter extends OncePerRequestFilter {

    public static final String PRINCIPAL_ATTRIBUTE = CookieAuthenticationFilter.class.getName() + ".principal";

    private static final Logger log = LoggerFactory.getLogger(CookieAuthenticationFilter.class);

    private final SessionStore sessionStore;
    private final SessionOptions options;
    private final Clock clock;

    public CookieAuthenticationFilter(SessionStore sessionStore, SessionOptions options, Clock clock) {
        this.sessionStore = sessionStore;
        this.options = options;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> token = sessionToken(request);
        if (token.isPresent()) {
            Instant now = clock.instant();
            Optional<Session> session = sessionStore.resolve(token.get(), now);
            session.ifPresent(live -> authenticate(live, request, response, now));
        }
        filterChain.doFilter(request, response);
    }

    private void authenticate(Session session, HttpServletRequest request, HttpServletResponse response, Instant now) {
        Principal principal = session.principal();
        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        CorrelationContextHolder.update(context -> context.withUserId(principal.name()));
        if (session.renewed()) {
            log.debug("Renewed session of {} until {}", principal.name(), session.expiresAt());
            response.addHeader(HttpHeaders.SET_COOKIE,
                    SessionCookies.issue(options, session, request.isSecure(), now));
        }
    }

    private Optional<String> sessionToken(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        for (Cookie cookie : cookies) {
            if (options.cookieName().equals(cookie.getName()) && !cookie.getValue().isBlank()) {
                return Optional.of(cookie.getValue());
            }
        }
        return Optional.empty();
    }
}
