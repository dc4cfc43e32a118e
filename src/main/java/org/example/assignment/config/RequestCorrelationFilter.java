package org.example.assignment.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id, echoed in the response and put in the logging MDC.
 * Async dispatches of the same request keep the id assigned on the first pass.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    private static final int MAX_REQUEST_ID_LENGTH = 80;

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = existingRequestId(request);
        if (requestId == null) {
            requestId = normalizeHeader(request.getHeader(RequestCorrelation.HEADER_NAME));
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }

        request.setAttribute(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        response.setHeader(RequestCorrelation.HEADER_NAME, requestId);
        MDC.put(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestCorrelation.ATTRIBUTE_NAME);
        }
    }

    private String existingRequestId(HttpServletRequest request) {
        if (request.getAttribute(RequestCorrelation.ATTRIBUTE_NAME) instanceof String value && !value.isBlank()) {
            return value;
        }
        return null;
    }

    private String normalizeHeader(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > MAX_REQUEST_ID_LENGTH) {
            trimmed = trimmed.substring(0, MAX_REQUEST_ID_LENGTH);
        }
        return trimmed;
    }
}
