package com.webapp.authservice.SecurityConfig;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Redis-backed blacklist of logged-out access tokens, keyed by {@code jti} and kept until the token expires.
 * Redis faults fail open: the signature, expiry and session checks still apply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenBlacklistConfig {

    static final String KEY_PREFIX = "jwt:bl:jti:";
    private static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final StringRedisTemplate redis;
    private final JwtTokenProviderConfig jwtService;
    private final Clock clock;

    /** Parses the token for its jti and expiry; invalid or already-expired tokens are ignored. */
    public void addToBlacklist(String token) {
        if (token == null || token.isBlank()) return;
        jwtService.validate(token).ifPresent(claims ->
                addToBlacklist(claims.getId(), claims.getExpiration().toInstant()));
    }

    public void addToBlacklist(String jwtId, Instant expiresAt) {
        if (jwtId == null || jwtId.isBlank() || expiresAt == null) return;
        Duration ttl = Duration.between(clock.instant(), expiresAt);
        if (ttl.isNegative() || ttl.isZero()) return;
        if (ttl.compareTo(MIN_TTL) < 0) ttl = MIN_TTL;
        try {
            redis.opsForValue().set(KEY_PREFIX + jwtId, "1", ttl);
        } catch (DataAccessException dae) {
            log.warn("Redis unavailable while blacklisting jti={}", jwtId, dae);
        }
    }

    public boolean isBlacklisted(String jwtId) {
        if (jwtId == null || jwtId.isBlank()) return false;
        try {
            return Boolean.TRUE.equals(redis.hasKey(KEY_PREFIX + jwtId));
        } catch (DataAccessException dae) {
            log.warn("Redis unavailable during blacklist check", dae);
            return false;
        }
    }
}
