package com.weave.security;

import java.time.Instant;
import java.util.Optional;

/**
 * Issues and validates cookie sessions.
 * <p>
 * Implementations must be safe for concurrent use: every request thread resolves the session of
 * its own cookie against the same store.
 */
public interface SessionStore {

    /**
     * Creates a session for the principal.
     *
     * @param principal identity to bind
     * @param now       issue time
     * @return the new session; its token is the cookie value
     */
    Session signIn(Principal principal, Instant now);

    /**
     * Looks up a live session. Expired sessions are removed and reported as absent.
     *
     * @param token cookie value (may be null)
     * @param now   resolution time
     * @return the session, with {@link Session#renewed()} set if sliding expiration extended it
     */
    Optional<Session> resolve(String token, Instant now);

    /**
     * Ends a session. Unknown or null tokens are ignored.
     */
    void signOut(String token);
}
