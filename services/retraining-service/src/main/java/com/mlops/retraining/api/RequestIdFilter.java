package com.mlops.retraining.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Echoes the request's trace and request ids and exposes them to log lines through the MDC.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestIdFilter.class);

    static final String TRACE_MDC_KEY = "trace_id";
    static final String REQUEST_MDC_KEY = "request_id";

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = RequestIdUtil.traceId(request);
        String requestId = RequestIdUtil.requestId(request);
        response.setHeader(RequestIdUtil.TRACE_HEADER, traceId);
        response.setHeader(RequestIdUtil.REQUEST_HEADER, requestId);
        MDC.put(TRACE_MDC_KEY, traceId);
        MDC.put(REQUEST_MDC_KEY, requestId);
        long startedAt = System.nanoTime();

        try {
            filterChain.doFilter(request, response);
        } finally {
            long latencyMs = (System.nanoTime() - startedAt) / 1_000_000L;
            logger.info(
                "http_request method={} path={} status={} latency_ms={}",
                request.getMethod(),
                request.getRequestURI(),
                response.getStatus(),
                latencyMs
            );
            MDC.remove(TRACE_MDC_KEY);
            MDC.remove(REQUEST_MDC_KEY);
        }
    }
}
