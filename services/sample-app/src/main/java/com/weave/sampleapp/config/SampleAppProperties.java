package com.weave.sampleapp.config;

import com.weave.security.CookieSecurePolicy;
import com.weave.security.SessionOptions;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the sample app, bound from {@code weave.app.*}.
 *
 * <pre>
 * weave:
 *   app:
 *     name: weave-sample-app
 *     issuer: http://localhost:5000
 *     session-lifetime: 7d
 *     cookie-secure: same-as-request
 * </pre>
 *
 * @param name              application name used for logging and metrics. Required.
 * @param environment       deployment environment (development, test, production)
 * @param issuer            issuer stamped on the claims of signed-in principals
 * @param authScheme        authentication scheme name (default "Cookie")
 * @param cookieName        session cookie name (default ".Weave." + authScheme)
 * @param sessionLifetime   session lifetime (default 7 days)
 * @param slidingExpiration whether sessions past half their lifetime are renewed (default true)
 * @param cookieSecure      when the session cookie is marked Secure
 */
@ConfigurationProperties(prefix = "weave.app")
@Validated
public record SampleAppProperties(
        @NotBlank String name,
        String environment,
        String issuer,
        String authScheme,
        String cookieName,
        Duration sessionLifetime,
        Boolean slidingExpiration,
        CookieSecurePolicy cookieSecure) {

    public static final String DEFAULT_ISSUER = "http://localhost:5000";

    /**
     * Applies defaults for optional fields. Runs BEFORE Bean Validation, so
     * defaults satisfy constraints.
     */
    public SampleAppProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = DEFAULT_ISSUER;
        }
        if (authScheme == null || authScheme.isBlank()) {
            authScheme = SessionOptions.DEFAULT_SCHEME;
        }
        if (cookieName == null || cookieName.isBlank()) {
            cookieName = SessionOptions.COOKIE_PREFIX + authScheme;
        }
        if (sessionLifetime == null) {
            sessionLifetime = SessionOptions.DEFAULT_LIFETIME;
        }
        if (slidingExpiration == null) {
            slidingExpiration = Boolean.TRUE;
        }
        if (cookieSecure == null) {
            cookieSecure = CookieSecurePolicy.SAME_AS_REQUEST;
        }
    }

    /** Session cookie settings derived from these properties. Cookies are always HTTP-only. */
    public SessionOptions sessionOptions() {
        return new SessionOptions(authScheme, cookieName, sessionLifetime, slidingExpiration, true, cookieSecure);
    }
}
