package com.webapp.authservice.SecurityConfig;

import com.webapp.authservice.entity.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Issues and verifies HS256 access tokens.
 * The subject is the user id; the login email, handle, display name and session id travel as private claims.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtTokenProviderConfig {

    public static final String CLAIM_USER_ID = "user_id";
    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_DISPLAY_NAME = "display_name";
    public static final String CLAIM_VERIFIED = "is_verified";
    public static final String CLAIM_TOKEN_TYPE = "token_type";
    public static final String CLAIM_SESSION_ID = "session_id";
    public static final String ACCESS_TOKEN_TYPE = "access";

    private final Clock clock;

    @Value("${token.key.secret}")
    private String secret;

    @Value("${token.key.jwtExpiration:900000}")
    private long jwtExpiration;

    @Value("${token.key.issuer:}")
    private String issuer;

    @Value("${token.key.audience:}")
    private String audience;

    @Value("${token.key.clock-skew-seconds:0}")
    private long clockSkewSeconds;

    private SecretKey signingKey;
    private JwtParser jwtParser;

    @PostConstruct
    void init() {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must be provided (base64).");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (RuntimeException e) {
            throw new IllegalStateException("JWT secret must be valid Base64.", e);
        }
        if (keyBytes.length < 32) {
            throw new IllegalStateException("JWT secret too short for HS256. Provide >= 256-bit Base64 key.");
        }
        if (jwtExpiration < 1000) {
            throw new IllegalStateException("token.key.jwtExpiration must be at least 1000 ms.");
        }

        signingKey = Keys.hmacShaKeyFor(keyBytes);

        JwtParserBuilder parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(Math.max(0, clockSkewSeconds));
        if (hasText(issuer)) {
            parserBuilder.requireIssuer(issuer);
        }
        if (hasText(audience)) {
            parserBuilder.requireAudience(audience);
        }
        jwtParser = parserBuilder.build();
    }

    /** A freshly signed access token with the identifiers the caller needs to persist alongside it. */
    public record IssuedAccessToken(String token, String jwtId, Instant expiresAt) {}

    public IssuedAccessToken generateAccessToken(User user, String sessionId) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plusMillis(jwtExpiration);
        String jwtId = UUID.randomUUID().toString();
        String userId = String.valueOf(user.getId());

        JwtBuilder builder = Jwts.builder()
                .id(jwtId)
                .subject(userId)
                .claim(CLAIM_USER_ID, userId)
                .claim(CLAIM_USERNAME, user.getHandle())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_DISPLAY_NAME, user.getDisplayName())
                .claim(CLAIM_VERIFIED, user.isEmailConfirmed())
                .claim(CLAIM_TOKEN_TYPE, ACCESS_TOKEN_TYPE)
                .claim(CLAIM_SESSION_ID, sessionId)
                .issuedAt(Date.from(now))
                .notBefore(Date.from(now))
                .expiration(Date.from(expiresAt));
        if (hasText(issuer)) {
            builder.issuer(issuer);
        }
        if (hasText(audience)) {
            builder.audience().add(audience).and();
        }

        String token = builder.signWith(signingKey, Jwts.SIG.HS256).compact();
        return new IssuedAccessToken(token, jwtId, expiresAt);
    }

    /**
     * Signature, expiry, issuer, audience and token type all checked.
     * Empty when any check fails; never throws for a bad token.
     */
    public Optional<Claims> validate(String token) {
        try {
            Claims claims = extractAllClaims(token);
            if (!ACCESS_TOKEN_TYPE.equals(claims.get(CLAIM_TOKEN_TYPE, String.class))) {
                log.debug("Rejected JWT with token_type={}", claims.get(CLAIM_TOKEN_TYPE));
                return Optional.empty();
            }
            return Optional.of(claims);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean isTokenValid(String token) {
        return validate(token).isPresent();
    }

    /** Valid access token whose email claim names the given principal. */
    public boolean validateToken(String token, UserDetails userDetails) {
        if (userDetails == null) return false;
        return validate(token)
                .map(c -> userDetails.getUsername().equalsIgnoreCase(c.get(CLAIM_EMAIL, String.class)))
                .orElse(false);
    }

    public String extractEmail(String token) {
        return extractClaim(token, c -> c.get(CLAIM_EMAIL, String.class));
    }

    public UUID extractUserId(String token) {
        return extractClaim(token, c -> UUID.fromString(c.getSubject()));
    }

    public String extractSessionId(String token) {
        return extractClaim(token, c -> c.get(CLAIM_SESSION_ID, String.class));
    }

    public String extractJwtId(String token) {
        return extractClaim(token, Claims::getId);
    }

    public Instant extractExpiration(String token) {
        return extractClaim(token, c -> c.getExpiration().toInstant());
    }

    public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        return claimsResolver.apply(extractAllClaims(token));
    }

    private Claims extractAllClaims(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Failed to parse JWT token.");
        }
        try {
            return jwtParser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid JWT token: {}", e.getMessage());
            throw new IllegalArgumentException("Failed to parse JWT token.", e);
        }
    }

    public long getTokenValiditySeconds() {
        return jwtExpiration / 1000;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
