package com.libraria.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.libraria.backend.modules.auth.application.JwtTokenService;
import com.libraria.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.libraria.backend.modules.auth.presentation.dto.TokenResponse;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-key-with-at-least-32-bytes!!";
    private static final long TTL_MILLIS = 900_000L;

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    @Test
    void issuedTokenParsesBackToSameClaims() {
        Clock clock = Clock.fixed(Instant.now(), ZoneOffset.UTC);
        JwtTokenService service = new JwtTokenService(provider, TTL_MILLIS, clock);
        UUID userId = UUID.randomUUID();

        TokenResponse token = service.issueAccessToken(userId, "ana@example.com", List.of("MEMBER", "LIBRARIAN"));
        JwtTokenService.ParsedToken parsed = service.parseAccessToken(token.accessToken());

        assertThat(token.tokenType()).isEqualTo("Bearer");
        assertThat(token.expiresIn()).isEqualTo(900);
        assertThat(parsed.userId()).isEqualTo(userId);
        assertThat(parsed.email()).isEqualTo("ana@example.com");
        assertThat(parsed.roles()).containsExactly("MEMBER", "LIBRARIAN");
    }

    @Test
    void expiredTokenIsRejected() {
        Instant issuedAt = Instant.parse("2025-01-01T00:00:00Z");
        JwtTokenService issuer = new JwtTokenService(provider, TTL_MILLIS, Clock.fixed(issuedAt, ZoneOffset.UTC));
        JwtTokenService laterReader = new JwtTokenService(
                provider, TTL_MILLIS, Clock.fixed(issuedAt.plusSeconds(3600), ZoneOffset.UTC));

        String token = issuer.issueAccessToken(UUID.randomUUID(), "ana@example.com", List.of("MEMBER")).accessToken();

        assertThatThrownBy(() -> laterReader.parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        Clock clock = Clock.fixed(Instant.now(), ZoneOffset.UTC);
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-secret-key-that-is-also-long-enough"), TTL_MILLIS, clock);
        JwtTokenService service = new JwtTokenService(provider, TTL_MILLIS, clock);

        String token = other.issueAccessToken(UUID.randomUUID(), "ana@example.com", List.of("MEMBER")).accessToken();

        assertThatThrownBy(() -> service.parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
        assertThatThrownBy(() -> service.parseAccessToken("not-a-jwt"))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    void shortSecretIsRefused() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalStateException.class);
    }
}
