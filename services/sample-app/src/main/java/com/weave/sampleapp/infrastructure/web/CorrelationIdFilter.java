package com.weave.sampleapp.infrastructure.web;

import com.weave.observability.CorrelationContext;
import com.weave.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>If the client sends {@code X-Correlation-ID} it is kept, otherwise a random UUID is used. The
 * ID goes into {@link CorrelationContextHolder} (and from there the SLF4J MDC) for the duration of
 * the request, and is echoed on the response.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so the ID is available to the authentication
 * filter and the router.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(CorrelationContext.of(correlationId));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // pooled threads must not carry the context into the next request
            CorrelationContextHolder.clear();
        }
    }
}
