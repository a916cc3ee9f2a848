package com.rolegate.guardedservice.infrastructure.web;

import com.rolegate.observability.CorrelationContext;
import com.rolegate.observability.CorrelationContextHolder;
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
 * Propagates or generates the correlation id of every HTTP request.
 *
 * <p>The id from {@code X-Correlation-ID} is reused when present, otherwise a UUID is generated.
 * It is installed in {@link CorrelationContextHolder} (and therefore the MDC) for the duration of
 * the request and echoed on the response, including on 401/403/503 answers from a guard. A fresh
 * request id is attached as well.
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

        CorrelationContextHolder.set(
                new CorrelationContext(correlationId, null, UUID.randomUUID().toString(), null, null));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // servlet threads are pooled
            CorrelationContextHolder.clear();
        }
    }
}
