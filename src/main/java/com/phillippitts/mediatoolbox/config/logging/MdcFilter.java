package com.phillippitts.mediatoolbox.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every HTTP request with a correlation id in the Log4j2 ThreadContext.
 *
 * <p>Keys: {@code requestId} (the {@code X-Request-ID} header, or a fresh UUID), {@code method}
 * and {@code uri}. The id is echoed back in the response header so a client can quote it when
 * reporting a failed job.
 *
 * <p>A job start request hands its context to the job executor, so the driving task of a job logs
 * under the request that started it. The thread's context is cleared when the request returns.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = requestIdOf(request);
        ThreadContext.put("requestId", requestId);
        ThreadContext.put("method", request.getMethod());
        ThreadContext.put("uri", request.getRequestURI());
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String requestIdOf(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (header == null || header.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return header.trim();
    }
}
