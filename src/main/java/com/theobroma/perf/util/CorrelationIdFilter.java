package com.theobroma.perf.util;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import io.opentelemetry.api.trace.Span;

import lombok.extern.slf4j.Slf4j;

/**
 * Servlet filter for correlation ID management.
 *
 * 1. Takes the correlation ID from the X-Correlation-ID request header, or generates one
 * 2. Puts it into the MDC, so every log line of the request carries it, slow query
 *    warnings included
 * 3. Returns it in the X-Correlation-ID response header
 * 4. Attaches it to the current OpenTelemetry span when an agent provides one
 * 5. Clears the MDC afterwards
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements Filter {

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /**
     * MDC key, referenced by logback-spring.xml.
     */
    static final String CORRELATION_ID_MDC_KEY = "correlationId";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        try {
            String correlationId = extractOrGenerateCorrelationId(httpRequest);

            MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
            httpResponse.setHeader(CORRELATION_ID_HEADER, correlationId);

            // No-op span unless an OpenTelemetry agent is attached
            Span currentSpan = Span.current();
            currentSpan.setAttribute("correlation.id", correlationId);

            log.debug("Processing {} {} with correlationId: {}",
                httpRequest.getMethod(), httpRequest.getRequestURI(), correlationId);

            chain.doFilter(request, response);
        } finally {
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    private String extractOrGenerateCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);

        if (correlationId != null && !correlationId.trim().isEmpty()) {
            try {
                UUID.fromString(correlationId);
                return correlationId;
            } catch (IllegalArgumentException e) {
                log.warn("Invalid correlation ID in header: {}. Generating new one.", correlationId);
            }
        }

        return UUID.randomUUID().toString();
    }

    /**
     * @return correlation ID of the current request, or null outside a request
     */
    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }
}
