package com.weave.security;

/**
 * When the session cookie is marked {@code Secure}.
 */
public enum CookieSecurePolicy {

    /** Secure only when the request that sets it arrived over TLS. */
    SAME_AS_REQUEST,
    ALWAYS,
    NONE;

    public boolean isSecure(boolean requestIsSecure) {
        return switch (this) {
            case SAME_AS_REQUEST -> requestIsSecure;
            case ALWAYS -> true;
            case NONE -> false;
        };
    }
}
