package com.weave.security;

/**
 * Role-based access control checks over a {@link Principal}.
 * <p>
 * A null principal (anonymous request) never satisfies a role check.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the principal carries the required role.
     */
    public static boolean hasRole(Principal principal, String required) {
        return principal != null && principal.isInRole(required);
    }

    /**
     * Checks if the principal carries ANY of the required roles.
     */
    public static boolean hasAnyRole(Principal principal, String... required) {
        for (String role : required) {
            if (hasRole(principal, role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if the principal carries ALL of the required roles.
     */
    public static boolean hasAllRoles(Principal principal, String... required) {
        if (principal == null) {
            return false;
        }
        for (String role : required) {
            if (!hasRole(principal, role)) {
                return false;
            }
        }
        return true;
    }
}
