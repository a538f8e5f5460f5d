package com.example.userservice.common.logging;

import java.io.IOException;
import java.util.UUID;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Tags each request with a request id and writes one access line once the response is committed.
 *
 * <p>{@link #MDC_ERROR_CODE} is filled by the exception handler when a request fails, so failed calls
 * are logged with the code the client received.
 */
public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_ERROR_CODE = "errorCode";

    private static final String UNMATCHED_ROUTE = "-";

    private final String requestIdHeader;

    public AccessLogFilter(String requestIdHeader) {
        this.requestIdHeader = requestIdHeader;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long startedAtNanos = System.nanoTime();
        String requestId = resolveRequestId(request);
        response.setHeader(requestIdHeader, requestId);

        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            long costMs = (System.nanoTime() - startedAtNanos) / 1_000_000L;
            String errorCode = MDC.get(MDC_ERROR_CODE);
            if (errorCode == null) {
                log.info("ACCESS {} route={} status={} costMs={}",
                        request.getMethod(), route(request), response.getStatus(), costMs);
            } else {
                log.info("ACCESS {} route={} status={} code={} costMs={}",
                        request.getMethod(), route(request), response.getStatus(), errorCode, costMs);
            }
            MDC.remove(MDC_ERROR_CODE);
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private String resolveRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(requestIdHeader);
        if (requestId == null || requestId.trim().isEmpty()) {
            return UUID.randomUUID().toString().replace("-", "");
        }
        return requestId.trim();
    }

    // mapping pattern such as /api/users/{id}, so ids stay out of the access line
    private String route(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : UNMATCHED_ROUTE;
    }
}
