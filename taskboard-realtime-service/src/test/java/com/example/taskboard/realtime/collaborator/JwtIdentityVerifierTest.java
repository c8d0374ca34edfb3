package com.example.taskboard.realtime.collaborator;

import com.example.taskboard.realtime.support.MutableClock;
import com.example.taskboard.realtime.support.TestTokens;
import com.example.taskboard.shared.collaborator.UserIdentity;
import com.example.taskboard.shared.exception.AuthenticationFailureException;
import com.example.taskboard.shared.util.Constants;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtIdentityVerifierTest {

    private final MutableClock clock = new MutableClock(Instant.now());
    private final TestTokens tokens = new TestTokens(TestTokens.SECRET, clock);
    private final JwtIdentityVerifier verifier = new JwtIdentityVerifier(TestTokens.SECRET, clock);
    private final UUID userId = UUID.randomUUID();

    @Test
    void acceptsValidAccessToken() {
        UserIdentity identity = verifier.verify(tokens.access(userId, "alice"));

        assertThat(identity.userId()).isEqualTo(userId);
        assertThat(identity.username()).isEqualTo("alice");
        assertThat(identity.displayName()).isEqualTo("alice");
    }

    @Test
    void usesDisplayNameClaimWhenPresent() {
        UserIdentity identity = verifier.verify(tokens.access(userId, "alice", "Alice Anders"));

        assertThat(identity.displayName()).isEqualTo("Alice Anders");
    }

    @Test
    void rejectsExpiredToken() {
        String token = tokens.access(userId, "alice");
        clock.advance(Duration.ofHours(2));

        assertThatThrownBy(() -> verifier.verify(token))
                .isInstanceOf(AuthenticationFailureException.class)
                .hasMessage(Constants.ClientMessages.INVALID_TOKEN);
    }

    @Test
    void rejectsRefreshToken() {
        assertThatThrownBy(() -> verifier.verify(tokens.refresh(userId, "alice")))
                .isInstanceOf(AuthenticationFailureException.class)
                .hasMessage(Constants.ClientMessages.INVALID_TOKEN);
    }

    @Test
    void rejectsTokenSignedWithAnotherKey() {
        TestTokens forged = new TestTokens("another-secret-that-is-also-long-enough-for-hs256", clock);

        assertThatThrownBy(() -> verifier.verify(forged.access(userId, "alice")))
                .isInstanceOf(AuthenticationFailureException.class);
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> verifier.verify("not-a-jwt"))
                .isInstanceOf(AuthenticationFailureException.class)
                .hasMessage(Constants.ClientMessages.INVALID_TOKEN);
    }

    @Test
    void rejectsSubjectThatIsNotAUserId() {
        assertThatThrownBy(() -> verifier.verify(tokens.withSubject("alice", "alice")))
                .isInstanceOf(AuthenticationFailureException.class)
                .hasMessage(Constants.ClientMessages.INVALID_USER_ID);
    }
}
