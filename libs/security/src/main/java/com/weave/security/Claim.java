package com.weave.security;

import java.util.Objects;

/**
 * A single statement about an authenticated identity, such as its name or one of its roles.
 *
 * @param type      claim type URI (see {@link ClaimTypes})
 * @param value     claim value
 * @param valueType value type URI (see {@link ClaimTypes#STRING})
 * @param issuer    who asserted the claim
 */
public record Claim(String type, String value, String valueType, String issuer) {

    public Claim {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        if (valueType == null || valueType.isBlank()) {
            valueType = ClaimTypes.STRING;
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = ClaimTypes.LOCAL_AUTHORITY;
        }
    }

    /** Creates a string-valued claim. */
    public static Claim of(String type, String value, String issuer) {
        return new Claim(type, value, ClaimTypes.STRING, issuer);
    }
}
