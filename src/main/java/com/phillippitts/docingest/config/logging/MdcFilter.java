package com.phillippitts.docingest.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Puts request correlation values into Log4j2's ThreadContext for the duration of a request.
 *
 * <p>Keys: {@code requestId} (from {@value #REQUEST_ID_HEADER} or generated, echoed back on the
 * response), {@code userId} (from {@value #USER_ID_HEADER} when present), {@code method} and
 * {@code uri}.
 *
 * <p>Runs once per request, so the async dispatches of an SSE subscription do not mint a second
 * request id. Batch work started by the request inherits the values through the ingest
 * executor's task decorator.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (isBlank(requestId)) {
            requestId = UUID.randomUUID().toString();
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);

        Map<String, String> values = new LinkedHashMap<>();
        values.put("requestId", requestId);
        String userId = request.getHeader(USER_ID_HEADER);
        if (!isBlank(userId)) {
            values.put("userId", userId);
        }
        values.put("method", request.getMethod());
        values.put("uri", request.getRequestURI());

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(values)) {
            chain.doFilter(request, response);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
