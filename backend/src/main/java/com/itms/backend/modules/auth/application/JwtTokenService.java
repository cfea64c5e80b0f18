package com.itms.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.itms.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.itms.backend.modules.auth.presentation.dto.AccessTokenResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    private static final String CLAIM_LOGIN_ID = "loginId";
    private static final String CLAIM_ROLES = "roles";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public AccessTokenResponse issueAccessToken(UUID userId, String loginId, List<String> roles) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        SecretKey key = tokenProvider.getSecretKey();
        String accessToken = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_LOGIN_ID, loginId)
                .claim(CLAIM_ROLES, roles)
                .signWith(key, SIG.HS256)
                .compact();

        return new AccessTokenResponse(
                accessToken,
                AccessTokenResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String loginId = claims.get(CLAIM_LOGIN_ID, String.class);
            List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    loginId,
                    roles,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public record ParsedToken(UUID userId, String loginId, List<String> roles, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
