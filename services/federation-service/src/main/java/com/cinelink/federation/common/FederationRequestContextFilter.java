package com.cinelink.federation.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds request and trace ids for the duration of a request, echoes them back as
 * headers and writes one access line when the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class FederationRequestContextFilter extends OncePerRequestFilter {
    static final String REQUEST_ID_HEADER = "x-request-id";
    static final String TRACE_ID_HEADER = "x-trace-id";

    private static final Logger logger = LoggerFactory.getLogger(FederationRequestContextFilter.class);

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        RequestContext context = new RequestContext(
            IdGenerator.resolveRequestId(request.getHeader(REQUEST_ID_HEADER)),
            IdGenerator.resolveTraceId(request.getHeader(TRACE_ID_HEADER))
        );
        response.setHeader(REQUEST_ID_HEADER, context.requestId());
        response.setHeader(TRACE_ID_HEADER, context.traceId());

        long startedAt = System.nanoTime();
        RequestContextHolder.bind(context);
        try {
            filterChain.doFilter(request, response);
        } finally {
            logger.info(
                "access method={} path={} status={} latency_ms={}",
                request.getMethod(),
                request.getRequestURI(),
                response.getStatus(),
                (System.nanoTime() - startedAt) / 1_000_000L
            );
            RequestContextHolder.unbind();
        }
    }
}
