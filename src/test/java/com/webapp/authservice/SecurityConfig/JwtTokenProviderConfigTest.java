package com.webapp.authservice.SecurityConfig;

import com.webapp.authservice.entity.User;
import com.webapp.authservice.support.TestUsers;
import io.jsonwebtoken.Claims;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenProviderConfigTest {

    private static final String SECRET = "xD0Rw91ovIinFe3A9aZEeeOUe1IcanlafDhgdKFNqinKBwBq+2O1oGsgD2nQth5S";
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private JwtTokenProviderConfig provider;
    private User user;

    @BeforeEach
    void setUp() {
        provider = provider(Clock.fixed(NOW, ZoneOffset.UTC), "webapp");
        user = TestUsers.confirmed("alice");
    }

    private static JwtTokenProviderConfig provider(Clock clock, String audience) {
        JwtTokenProviderConfig p = new JwtTokenProviderConfig(clock);
        ReflectionTestUtils.setField(p, "secret", SECRET);
        ReflectionTestUtils.setField(p, "jwtExpiration", 900_000L);
        ReflectionTestUtils.setField(p, "issuer", "webapp-auth");
        ReflectionTestUtils.setField(p, "audience", audience);
        ReflectionTestUtils.setField(p, "clockSkewSeconds", 0L);
        p.init();
        return p;
    }

    @Test
    @DisplayName("generated token carries identity and session claims")
    void generatedTokenCarriesClaims() {
        var issued = provider.generateAccessToken(user, "session-1");

        Claims claims = provider.validate(issued.token()).orElseThrow();

        assertThat(claims.getSubject()).isEqualTo(user.getId().toString());
        assertThat(claims.getId()).isEqualTo(issued.jwtId());
        assertThat(claims.get(JwtTokenProviderConfig.CLAIM_EMAIL, String.class)).isEqualTo("alice@example.com");
        assertThat(claims.get(JwtTokenProviderConfig.CLAIM_USERNAME, String.class)).isEqualTo("alice");
        assertThat(claims.get(JwtTokenProviderConfig.CLAIM_SESSION_ID, String.class)).isEqualTo("session-1");
        assertThat(issued.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(provider.extractUserId(issued.token())).isEqualTo(user.getId());
        assertThat(provider.validateToken(issued.token(), user)).isTrue();
    }

    @Test
    void extractorsReadSessionJtiAndExpiryFromTheToken() {
        var issued = provider.generateAccessToken(user, "session-7");

        assertThat(provider.extractSessionId(issued.token())).isEqualTo("session-7");
        assertThat(provider.extractJwtId(issued.token())).isEqualTo(issued.jwtId());
        assertThat(provider.extractExpiration(issued.token())).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(provider.extractEmail(issued.token())).isEqualTo("alice@example.com");
        assertThat(provider.getTokenValiditySeconds()).isEqualTo(900);
    }

    @Test
    void expiredTokenIsRejected() {
        String token = provider.generateAccessToken(user, "session-1").token();

        JwtTokenProviderConfig later = provider(Clock.fixed(NOW.plus(Duration.ofMinutes(16)), ZoneOffset.UTC), "webapp");

        assertThat(later.isTokenValid(token)).isFalse();
    }

    @Test
    void tamperedOrForeignAudienceTokenIsRejected() {
        String token = provider.generateAccessToken(user, "session-1").token();
        String other = provider.generateAccessToken(TestUsers.confirmed("bob"), "session-2").token();
        String tampered = token.substring(0, token.lastIndexOf('.')) + other.substring(other.lastIndexOf('.'));

        assertThat(provider.validate(tampered)).isEmpty();
        assertThat(provider(Clock.fixed(NOW, ZoneOffset.UTC), "other-app").isTokenValid(token)).isFalse();
    }

    @Test
    void tokenForAnotherPrincipalDoesNotValidate() {
        String token = provider.generateAccessToken(user, "session-1").token();

        assertThat(provider.validateToken(token, TestUsers.confirmed("bob"))).isFalse();
        assertThat(provider.validateToken(token, null)).isFalse();
    }

    @Test
    void extractingFromGarbageThrowsIllegalArgument() {
        assertThatThrownBy(() -> provider.extractEmail("not-a-jwt"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Failed to parse JWT token.");
        assertThat(provider.validate("")).isEmpty();
    }

    @Test
    void shortSecretFailsFast() {
        JwtTokenProviderConfig p = new JwtTokenProviderConfig(Clock.systemUTC());
        ReflectionTestUtils.setField(p, "secret", "c2hvcnQ=");
        ReflectionTestUtils.setField(p, "jwtExpiration", 900_000L);

        assertThatThrownBy(p::init).isInstanceOf(IllegalStateException.class);
    }
}
