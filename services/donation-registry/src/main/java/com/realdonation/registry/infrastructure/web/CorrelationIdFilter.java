package com.realdonation.registry.infrastructure.web;

import com.realdonation.observability.CorrelationContext;
import com.realdonation.observability.CorrelationContextHolder;
import com.realdonation.security.Address;
import com.realdonation.security.CallerAddressExtractor;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Establishes the {@link CorrelationContext} for every HTTP request.
 * <p>
 * The {@code X-Correlation-ID} header is propagated when present and generated otherwise, and is
 * echoed on the response. The caller address from {@code X-Caller-Address} is recorded for log
 * output only; controllers parse it again and reject calls without one. Span and trace ids are
 * taken from the current OpenTelemetry span when one is active. Every event appended while the
 * request runs carries the same correlation id.
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
        String caller = CallerAddressExtractor.extract(request.getHeader(CallerAddressExtractor.HEADER))
                .map(Address::toHex)
                .orElse(null);

        SpanContext span = Span.current().getSpanContext();
        String spanId = span.isValid() ? span.getSpanId() : null;
        String traceId = span.isValid() ? span.getTraceId() : null;

        CorrelationContextHolder.set(new CorrelationContext(
                correlationId, caller, UUID.randomUUID().toString(), spanId, traceId));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
