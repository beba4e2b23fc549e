package com.weave.security;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SessionStore} keeping sessions in a concurrent map.
 * <p>
 * Tokens are 256 random bits, URL-safe Base64 without padding, so they can be used as cookie
 * values unchanged. Sessions do not survive a restart.
 */
public final class InMemorySessionStore implements SessionStore {

    private static final int TOKEN_BYTES = 32;

    private final SessionOptions options;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public InMemorySessionStore(SessionOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
    }

    @Override
    public Session signIn(Principal principal, Instant now) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        purgeExpired(now);
        var session = new Session(newToken(), principal, now, now.plus(options.lifetime()), false);
        sessions.put(session.token(), session);
        return session;
    }

    @Override
    public Optional<Session> resolve(String token, Instant now) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Session session = sessions.get(token);
        if (session == null) {
            return Optional.empty();
        }
        if (!session.isLiveAt(now)) {
            sessions.remove(token, session);
            return Optional.empty();
        }
        if (options.slidingExpiration() && session.isPastHalfLifeAt(now)) {
            var renewed = new Session(token, session.principal(), now, now.plus(options.lifetime()), true);
            // a concurrent sign-out wins over the renewal
            if (sessions.replace(token, session, renewed)) {
                return Optional.of(renewed);
            }
            return Optional.ofNullable(sessions.get(token));
        }
        return Optional.of(session);
    }

    @Override
    public void signOut(String token) {
        if (token != null) {
            sessions.remove(token);
        }
    }

    /** Drops every session that has expired at {@code now}. */
    public void purgeExpired(Instant now) {
        sessions.values().removeIf(session -> !session.isLiveAt(now));
    }

    /** Number of sessions currently held, including any not yet purged. */
    public int size() {
        return sessions.size();
    }

    public SessionOptions options() {
        return options;
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
