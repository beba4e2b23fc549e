package com.weave.security;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Authenticated identity of the current session.
 * <p>
 * A principal may carry several claims of the same type (one per role). Name, claim map and
 * role set are all views over {@link #claims()}. Instances are immutable.
 *
 * @param authenticationScheme scheme that issued this principal (e.g. "Cookie")
 * @param claims               claims in the order they were asserted
 */
public record Principal(String authenticationScheme, List<Claim> claims) {

    public Principal {
        if (authenticationScheme == null || authenticationScheme.isBlank()) {
            throw new IllegalArgumentException("authenticationScheme must not be null or blank");
        }
        claims = List.copyOf(claims);
    }

    /** Identity name: the value of the first {@link ClaimTypes#NAME} claim, or null. */
    public String name() {
        return findFirst(ClaimTypes.NAME).orElse(null);
    }

    /** Value of the first claim of the given type. */
    public Optional<String> findFirst(String type) {
        return claims.stream()
                .filter(claim -> claim.type().equals(type))
                .map(Claim::value)
                .findFirst();
    }

    /** Claim type to the first value asserted for it. */
    public Map<String, String> claimValues() {
        Map<String, String> values = new LinkedHashMap<>();
        for (Claim claim : claims) {
            values.putIfAbsent(claim.type(), claim.value());
        }
        return values;
    }

    /** Values of every {@link ClaimTypes#ROLE} claim. */
    public Set<String> roles() {
        Set<String> roles = new LinkedHashSet<>();
        for (Claim claim : claims) {
            if (claim.type().equals(ClaimTypes.ROLE)) {
                roles.add(claim.value());
            }
        }
        return roles;
    }

    /** Whether this principal carries the given role (exact, case-sensitive match). */
    public boolean isInRole(String role) {
        return claims.stream()
                .anyMatch(claim -> claim.type().equals(ClaimTypes.ROLE) && claim.value().equals(role));
    }
}
