package com.weave.sampleapp.infrastructure.web;

import com.weave.security.Session;
import com.weave.security.SessionOptions;
import java.time.Duration;
import java.time.Instant;
import org.springframework.http.ResponseCookie;

/**
 * Builds {@code Set-Cookie} values for the session cookie.
 */
public final class SessionCookies {

    private SessionCookies() {
        // utility class
    }

    /** Cookie carrying {@code session}'s token, valid for the rest of its lifetime. */
    public static String issue(SessionOptions options, Session session, boolean requestSecure, Instant now) {
        return builder(options, session.token(), requestSecure)
                .maxAge(session.remainingAt(now))
                .build()
                .toString();
    }

    /** Cookie that makes the client drop the session cookie. */
    public static String expire(SessionOptions options, boolean requestSecure) {
        return builder(options, "", requestSecure)
                .maxAge(Duration.ZERO)
                .build()
                .toString();
    }

    private static ResponseCookie.ResponseCookieBuilder builder(
            SessionOptions options, String value, boolean requestSecure) {
        return ResponseCookie.from(options.cookieName(), value)
                .httpOnly(options.httpOnly())
                .secure(options.securePolicy().isSecure(requestSecure))
                .sameSite("Lax")
                .path("/");
    }
}
