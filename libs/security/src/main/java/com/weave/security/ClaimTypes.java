package com.weave.security;

/**
 * Well-known claim type and value type URIs.
 */
public final class ClaimTypes {

    public static final String NAME = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/name";
    public static final String SURNAME = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/surname";
    public static final String ROLE = "http://schemas.microsoft.com/ws/2008/06/identity/claims/role";

    /** Value type of plain string claims. */
    public static final String STRING = "http://www.w3.org/2001/XMLSchema#string";

    /** Issuer recorded when a claim does not name one. */
    public static final String LOCAL_AUTHORITY = "LOCAL AUTHORITY";

    private ClaimTypes() {
        // constants
    }
}
