package com.tokenledger.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Per-request JWT authentication filter.
 *
 * FLOW:
 *   1. Extract "Authorization: Bearer <token>" header
 *   2. Validate token signature and expiry via JwtTokenProvider
 *   3. Set an authentication whose principal (and name) is the user id
 *   4. Continue filter chain
 *
 * No user lookup happens here: accounts are created lazily by the ledger
 * the first time a user id shows up.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final JwtTokenProvider tokenProvider;

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider) {
        this.tokenProvider = tokenProvider;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest  request,
                                    HttpServletResponse response,
                                    FilterChain         chain)
            throws ServletException, IOException {

        log.debug("Authentication filter: {} {}", request.getMethod(), request.getRequestURI());

        String token = extractBearerToken(request);

        if (StringUtils.hasText(token)) {
            if (tokenProvider.isValid(token)) {
                String userId = tokenProvider.extractUserId(token);
                MDC.put("userId", userId);

                var auth = new UsernamePasswordAuthenticationToken(
                        userId,
                        null,
                        List.of(new SimpleGrantedAuthority("ROLE_USER"))
                );
                SecurityContextHolder.getContext().setAuthentication(auth);
                log.debug("User authenticated - userId={}", userId);
            } else {
                log.warn("Invalid JWT token - signature, expiry or subject check failed");
            }
        } else {
            log.debug("No JWT token in request (public endpoint or unauthenticated)");
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove("userId");
        }
    }

    /**
     * Extract the raw token from "Authorization: Bearer <token>".
     * Returns null if the header is absent or malformed.
     */
    private String extractBearerToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (StringUtils.hasText(header) && header.startsWith("Bearer ")) {
            return header.substring(7).strip();
        }
        return null;
    }
}
