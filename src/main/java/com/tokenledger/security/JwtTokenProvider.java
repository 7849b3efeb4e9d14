package com.tokenledger.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Signs and verifies bearer tokens.
 *
 * The ledger does not manage identities: whoever issues the token decides
 * who the user is. The only claim used is the subject, the opaque user id
 * that owns a token account.
 *
 * Token contains:
 *  - subject  : user id
 *  - iat      : issued-at
 *  - exp      : expiry
 */
@Component
public class JwtTokenProvider {

    private final SecretKey secretKey;
    private final long      expiryMs;

    public JwtTokenProvider(
            @Value("${tokenledger.jwt.secret}") String secret,
            @Value("${tokenledger.jwt.expiry-ms:86400000}") long expiryMs) {

        if (secret == null || secret.length() < 32) {
            throw new IllegalStateException(
                "tokenledger.jwt.secret must be at least 32 characters");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiryMs  = expiryMs;
    }

    /**
     * Issue a signed token whose subject is the given user id.
     *
     * Issuance helper for the identity side that shares the signing secret
     * (and for integration tests); this service itself only verifies tokens.
     */
    public String generateToken(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required to issue a token");
        }
        Date now    = new Date();
        Date expiry = new Date(now.getTime() + expiryMs);

        return Jwts.builder()
                .subject(userId)
                .issuedAt(now)
                .expiration(expiry)
                .signWith(secretKey)
                .compact();
    }

    /** Extract the user id (subject) from a valid token. */
    public String extractUserId(String token) {
        return parseClaims(token).getSubject();
    }

    /**
     * Validate token signature, expiry and subject.
     * Returns false instead of throwing; caller decides how to respond.
     */
    public boolean isValid(String token) {
        try {
            String subject = parseClaims(token).getSubject();
            return subject != null && !subject.isBlank();
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
