package com.tokenledger.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a correlation id into the MDC for every request.
 *
 * A caller-supplied X-Request-Id (up to 64 characters) is reused, otherwise a
 * random UUID is generated. The id is echoed in the X-Request-Id response header.
 *
 * Usage in logback pattern: %X{requestId} %X{method} %X{path}
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest  request,
                                    HttpServletResponse response,
                                    FilterChain         chain)
            throws ServletException, IOException {
        String requestId = resolveRequestId(request.getHeader(REQUEST_ID_HEADER));
        try {
            MDC.put("requestId", requestId);
            MDC.put("method",    request.getMethod());
            MDC.put("path",      request.getRequestURI());
            response.setHeader(REQUEST_ID_HEADER, requestId);
            chain.doFilter(request, response);
        } finally {
            MDC.clear();
        }
    }

    static String resolveRequestId(String supplied) {
        if (StringUtils.hasText(supplied)
                && supplied.length() <= MAX_REQUEST_ID_LENGTH
                && supplied.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_')) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }
}
