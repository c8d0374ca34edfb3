package com.example.taskboard.realtime.collaborator;

import com.example.taskboard.shared.collaborator.IdentityVerifier;
import com.example.taskboard.shared.collaborator.UserIdentity;
import com.example.taskboard.shared.exception.AuthenticationFailureException;
import com.example.taskboard.shared.util.Constants;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.UUID;

/**
 * Verifies HS256 access tokens issued by the taskboard auth service. The subject is
 * the user id; {@code username} is required and {@code display_name} optional.
 * Refresh tokens are refused.
 */
@Slf4j
public class JwtIdentityVerifier implements IdentityVerifier {

    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_DISPLAY_NAME = "display_name";
    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String ACCESS_TOKEN_TYPE = "Access";

    private final JwtParser parser;

    public JwtIdentityVerifier(String secret, Clock clock) {
        this.parser = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public UserIdentity verify(String credential) {
        Claims claims;
        try {
            claims = parser.parseSignedClaims(credential).getPayload();
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token for subject {}", e.getClaims().getSubject());
            throw new AuthenticationFailureException(Constants.ClientMessages.INVALID_TOKEN, e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw new AuthenticationFailureException(Constants.ClientMessages.INVALID_TOKEN, e);
        }

        String tokenType = claims.get(CLAIM_TOKEN_TYPE, String.class);
        if (!ACCESS_TOKEN_TYPE.equals(tokenType)) {
            log.debug("Rejected token of type {} for subject {}", tokenType, claims.getSubject());
            throw new AuthenticationFailureException(Constants.ClientMessages.INVALID_TOKEN);
        }

        UUID userId;
        try {
            userId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new AuthenticationFailureException(Constants.ClientMessages.INVALID_USER_ID, e);
        }

        String username = claims.get(CLAIM_USERNAME, String.class);
        if (username == null || username.isBlank()) {
            throw new AuthenticationFailureException(Constants.ClientMessages.INVALID_TOKEN);
        }
        String displayName = claims.get(CLAIM_DISPLAY_NAME, String.class);
        return new UserIdentity(userId, username, displayName != null ? displayName : username);
    }
}
