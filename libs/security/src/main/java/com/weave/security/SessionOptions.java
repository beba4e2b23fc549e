package com.weave.security;

import java.time.Duration;

/**
 * Cookie authentication settings.
 * <p>
 * The compact constructor fills in defaults for every optional value, so hosts can pass through
 * whatever their configuration left unset.
 *
 * @param authenticationScheme scheme name stamped on issued principals (default "Cookie")
 * @param cookieName           name of the session cookie (default ".Weave." + scheme)
 * @param lifetime             session lifetime (default 7 days)
 * @param slidingExpiration    whether resolving a half-expired session renews it
 * @param httpOnly             whether the cookie is hidden from scripts
 * @param securePolicy         when the cookie is marked Secure (default same as request)
 */
public record SessionOptions(
        String authenticationScheme,
        String cookieName,
        Duration lifetime,
        boolean slidingExpiration,
        boolean httpOnly,
        CookieSecurePolicy securePolicy) {

    public static final String DEFAULT_SCHEME = "Cookie";
    public static final String COOKIE_PREFIX = ".Weave.";
    public static final Duration DEFAULT_LIFETIME = Duration.ofDays(7);

    public SessionOptions {
        if (authenticationScheme == null || authenticationScheme.isBlank()) {
            authenticationScheme = DEFAULT_SCHEME;
        }
        if (cookieName == null || cookieName.isBlank()) {
            cookieName = COOKIE_PREFIX + authenticationScheme;
        }
        if (lifetime == null) {
            lifetime = DEFAULT_LIFETIME;
        }
        if (lifetime.isZero() || lifetime.isNegative()) {
            throw new IllegalArgumentException("lifetime must be positive");
        }
        if (securePolicy == null) {
            securePolicy = CookieSecurePolicy.SAME_AS_REQUEST;
        }
    }

    /** HTTP-only, sliding, seven-day sessions under the "Cookie" scheme. */
    public static SessionOptions defaults() {
        return new SessionOptions(null, null, null, true, true, null);
    }
}
