package com.example.commandservice.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Verifies access tokens and extracts the owner id. Tokens are issued elsewhere; nothing is minted here.
 */
@Service
@Slf4j
public class JwtService {

    @Value("${jwt.secret}")
    private String jwtSecret;

    /**
     * Verify signature and expiry, then read the owner id from the {@code userId} claim,
     * falling back to the subject.
     *
     * @throws JwtException if the token is malformed, expired or wrongly signed
     * @throws IllegalArgumentException if the id claim is not a UUID
     */
    public UUID extractOwnerId(String token) {
        Claims claims = extractAllClaims(token);
        String userId = claims.get("userId", String.class);
        if (userId == null) {
            userId = claims.getSubject();
        }
        if (userId == null) {
            throw new IllegalArgumentException("Token carries no subject");
        }
        return UUID.fromString(userId);
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parser()
                .verifyWith(getSigningKey())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    private SecretKey getSigningKey() {
        return Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }
}
