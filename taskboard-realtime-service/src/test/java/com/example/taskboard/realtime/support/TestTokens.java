package com.example.taskboard.realtime.support;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues tokens shaped like the ones the taskboard auth service hands out.
 */
public class TestTokens {

    public static final String SECRET = "test-secret-key-for-realtime-tests-only-0123456789";

    private final SecretKey key;
    private final Clock clock;

    public TestTokens(String secret, Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
    }

    public String access(UUID userId, String username) {
        return builder(userId.toString(), username, "Access", Duration.ofHours(1)).compact();
    }

    public String access(UUID userId, String username, String displayName) {
        return builder(userId.toString(), username, "Access", Duration.ofHours(1))
                .claim("display_name", displayName)
                .compact();
    }

    public String expired(UUID userId, String username) {
        return builder(userId.toString(), username, "Access", Duration.ofHours(-1)).compact();
    }

    public String refresh(UUID userId, String username) {
        return builder(userId.toString(), username, "Refresh", Duration.ofDays(7)).compact();
    }

    public String withSubject(String subject, String username) {
        return builder(subject, username, "Access", Duration.ofHours(1)).compact();
    }

    private JwtBuilder builder(String subject, String username, String tokenType, Duration validity) {
        Instant now = clock.instant();
        Instant issuedAt = validity.isNegative() ? now.plus(validity).minus(Duration.ofHours(1)) : now;
        return Jwts.builder()
                .subject(subject)
                .claim("username", username)
                .claim("token_type", tokenType)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(now.plus(validity)))
                .signWith(key);
    }
}
