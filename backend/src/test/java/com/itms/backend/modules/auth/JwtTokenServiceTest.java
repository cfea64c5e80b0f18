package com.itms.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.itms.backend.modules.auth.application.JwtTokenService;
import com.itms.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.itms.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.itms.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.itms.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.itms.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "test-itms-jwt-secret-with-at-least-32-bytes!!";

    private MutableClock clock;
    private JwtTokenService jwtTokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(OffsetDateTime.parse("2025-03-10T08:00:00Z"));
        jwtTokenService = new JwtTokenService(new JwtTokenProvider(SECRET), 3_600_000L, clock);
    }

    @Test
    void issuedTokenParsesBackToItsClaims() {
        UUID userId = UUID.randomUUID();

        AccessTokenResponse token = jwtTokenService.issueAccessToken(userId, "alice", List.of("MANAGER"));
        ParsedToken parsed = jwtTokenService.parseAccessToken(token.accessToken());

        assertThat(token.tokenType()).isEqualTo("Bearer");
        assertThat(token.expiresIn()).isEqualTo(3600L);
        assertThat(parsed.userId()).isEqualTo(userId);
        assertThat(parsed.loginId()).isEqualTo("alice");
        assertThat(parsed.roles()).containsExactly("MANAGER");
    }

    @Test
    void expiredTokenIsRejected() {
        AccessTokenResponse token = jwtTokenService.issueAccessToken(UUID.randomUUID(), "alice", List.of("USER"));
        clock.advance(Duration.ofHours(2));

        assertThatThrownBy(() -> jwtTokenService.parseAccessToken(token.accessToken()))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-itms-secret-that-is-long-enough-123"), 3_600_000L, clock);
        String foreign = other.issueAccessToken(UUID.randomUUID(), "mallory", List.of("ADMIN")).accessToken();

        assertThatThrownBy(() -> jwtTokenService.parseAccessToken(foreign))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shortSecretIsRefused() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalStateException.class);
    }
}
