package com.weave.security;

import java.time.Duration;
import java.time.Instant;

/**
 * A signed-in session as held by a {@link SessionStore}.
 *
 * @param token     opaque cookie value identifying the session
 * @param principal identity bound to the session
 * @param issuedAt  when the session (or its latest renewal) was issued
 * @param expiresAt when the session stops being valid
 * @param renewed   true if this instance was produced by a sliding renewal during resolution
 */
public record Session(String token, Principal principal, Instant issuedAt, Instant expiresAt, boolean renewed) {

    /** Whether the session is still valid at {@code now}. */
    public boolean isLiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    /** Whether more than half of the session's lifetime has elapsed at {@code now}. */
    public boolean isPastHalfLifeAt(Instant now) {
        Duration lifetime = Duration.between(issuedAt, expiresAt);
        return Duration.between(issuedAt, now).compareTo(lifetime.dividedBy(2)) > 0;
    }

    /** Time left until expiry at {@code now}, never negative. */
    public Duration remainingAt(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
