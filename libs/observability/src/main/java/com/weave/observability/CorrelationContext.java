package com.weave.observability;

/**
 * Immutable correlation context for a single HTTP request.
 * <p>
 * Established by the host's correlation filter for every incoming request and injected into
 * SLF4J MDC so that every log line written while the request is processed carries the same
 * identifiers. The user ID is attached later, once the session cookie has been resolved.
 *
 * @param correlationId unique ID for the request, propagated from {@code X-Correlation-ID} or generated
 * @param userId        identity name of the authenticated principal (nullable while anonymous)
 */
public record CorrelationContext(String correlationId, String userId) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for user ID.
     */
    public static final String MDC_USER_ID = "userId";

    /**
     * Ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates an anonymous context for the given correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null);
    }

    /** Returns a copy of this context bound to the given user. */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId);
    }
}
