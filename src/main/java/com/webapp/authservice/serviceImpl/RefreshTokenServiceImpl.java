package com.webapp.authservice.serviceImpl;

import com.webapp.authservice.dto.ClientContext;
import com.webapp.authservice.dto.IssuedRefreshToken;
import com.webapp.authservice.dto.RefreshTokenUsageStats;
import com.webapp.authservice.entity.RefreshToken;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.exception.AuthExceptions;
import com.webapp.authservice.repository.RefreshTokenRepository;
import com.webapp.authservice.service.RefreshTokenService;
import com.webapp.authservice.service.UserSessionService;
import com.webapp.authservice.utils.TokenHashing;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Objects;

/**
 * Refresh token store:
 * - Stores only the SHA-256 hash of each token.
 * - Rotation on every refresh; the spent token points at its successor.
 * - Presenting a spent token that already has a successor revokes the whole session.
 * - At most N active tokens per user (newest kept, oldest revoked).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefreshTokenServiceImpl implements RefreshTokenService {

    static final String REASON_REPLACED = "Replaced by new token";
    static final String REASON_REUSE = "Attempted reuse of revoked token";
    static final String REASON_LIMIT = "Session limit exceeded";
    static final String REASON_SESSION_ENDED = "Session ended";

    private final RefreshTokenRepository refreshTokenRepo;
    private final UserSessionService userSessionService;
    private final Clock clock;

    /** Absolute lifetime in ms. Default 7 days. */
    @Value("${refresh-token.expiration.milliseconds:604800000}")
    private long lifetimeMs = 604_800_000L;

    /** Max concurrently active tokens per user. */
    @Value("${refresh-token.max.count:5}")
    private int maxActive = 5;

    /** Entropy for raw token before Base64URL. */
    @Value("${refresh-token.random-bytes:64}")
    private int randomBytes = 64;

    /** How long used or revoked rows are kept for audit before the sweep deletes them. */
    @Value("${refresh-token.retention.days:30}")
    private long retentionDays = 30;

    private final SecureRandom random = new SecureRandom();

    @PostConstruct
    void init() {
        if (maxActive < 1) maxActive = 1;
        if (randomBytes < 32) randomBytes = 32;
        if (lifetimeMs < 60_000) lifetimeMs = 60_000;
    }

    // ============================== API ==============================

    @Override
    @Transactional
    public IssuedRefreshToken issue(User user, String sessionId, String jwtId, ClientContext client) {
        Instant now = clock.instant();
        ClientContext ctx = client != null ? client : ClientContext.unknown();

        String raw = TokenHashing.randomToken(random, randomBytes);
        RefreshToken model = RefreshToken.builder()
                .user(user)
                .tokenHash(TokenHashing.sha256Hex(raw))
                .sessionId(sessionId)
                .jwtId(jwtId)
                .issuedAt(now)
                .expiresAt(now.plusMillis(lifetimeMs))
                .createdByIp(ctx.getIpAddress())
                .userAgent(ctx.getUserAgent())
                .build();

        // Save first so this token is the newest when the cap is applied.
        refreshTokenRepo.save(model);
        enforceMaxActive(user, model, now, ctx.getIpAddress());

        return new IssuedRefreshToken(raw, model.getExpiresAt(), sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RefreshToken> findActive(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) return Optional.empty();
        Instant now = clock.instant();
        return refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(rawToken))
                .filter(t -> t.isActive(now));
    }

    /**
     * Failures that revoke something (reuse, ended session) must survive the exception,
     * hence no rollback for {@link AuthExceptions.InvalidRefreshToken}.
     */
    @Override
    @Transactional(noRollbackFor = AuthExceptions.InvalidRefreshToken.class)
    public RotatedRefreshToken rotate(String rawToken, ClientContext client) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new AuthExceptions.InvalidRefreshToken("Refresh token is required.");
        }
        Instant now = clock.instant();
        ClientContext ctx = client != null ? client : ClientContext.unknown();

        RefreshToken current = refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(rawToken))
                .orElseThrow(() -> new AuthExceptions.InvalidRefreshToken("Invalid refresh token."));

        if (current.isUsed() || current.isRevoked()) {
            if (current.getReplacedByTokenHash() != null) {
                log.warn("Refresh token reuse detected for user={} session={} ip={}",
                        current.getUser().getId(), current.getSessionId(), ctx.getIpAddress());
                revokeAllForSession(current.getSessionId(), ctx.getIpAddress(), REASON_REUSE);
                userSessionService.terminate(current.getSessionId());
                throw new AuthExceptions.InvalidRefreshToken("Refresh token reuse detected; session revoked.");
            }
            throw new AuthExceptions.InvalidRefreshToken("Refresh token has been revoked.");
        }
        if (current.isExpired(now)) {
            throw new AuthExceptions.InvalidRefreshToken("Refresh token has expired.");
        }
        if (userSessionService.findValid(current.getSessionId()).isEmpty()) {
            current.revoke(now, ctx.getIpAddress(), REASON_SESSION_ENDED, null);
            throw new AuthExceptions.InvalidRefreshToken("Session is no longer valid.");
        }

        User user = current.getUser();
        current.markUsed(now);
        IssuedRefreshToken next = issue(user, current.getSessionId(), null, ctx);
        current.revoke(now, ctx.getIpAddress(), REASON_REPLACED, TokenHashing.sha256Hex(next.raw()));

        return new RotatedRefreshToken(user, next);
    }

    @Override
    @Transactional
    public void bindAccessToken(String rawToken, String jwtId) {
        refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(rawToken))
                .ifPresent(t -> t.setJwtId(jwtId));
    }

    @Override
    @Transactional
    public boolean revoke(User user, String rawToken, String ip, String reason) {
        if (rawToken == null || rawToken.isBlank()) return false;
        Instant now = clock.instant();
        return refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(rawToken))
                .filter(t -> Objects.equals(t.getUser().getId(), user.getId()))
                .filter(t -> !t.isRevoked())
                .map(t -> {
                    t.revoke(now, ip, reason, null);
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public int revokeAllForUser(User user, String ip, String reason) {
        Instant now = clock.instant();
        List<RefreshToken> active = refreshTokenRepo.findAllByUserAndUsedFalseAndRevokedFalseAndExpiresAtAfter(user, now);
        active.forEach(t -> t.revoke(now, ip, reason, null));
        return active.size();
    }

    @Override
    @Transactional
    public int revokeAllForSession(String sessionId, String ip, String reason) {
        Instant now = clock.instant();
        List<RefreshToken> active =
                refreshTokenRepo.findAllBySessionIdAndUsedFalseAndRevokedFalseAndExpiresAtAfter(sessionId, now);
        active.forEach(t -> t.revoke(now, ip, reason, null));
        return active.size();
    }

    @Override
    @Transactional
    public int purgeExpiredAndRevoked(Instant now) {
        return refreshTokenRepo.deleteExpiredOrRetired(now, now.minus(retentionDays, ChronoUnit.DAYS));
    }

    @Override
    @Transactional(readOnly = true)
    public RefreshTokenUsageStats usageStats(User user) {
        Instant now = clock.instant();
        return new RefreshTokenUsageStats(
                refreshTokenRepo.countByUser(user),
                refreshTokenRepo.countByUserAndUsedFalseAndRevokedFalseAndExpiresAtAfter(user, now),
                refreshTokenRepo.countByUserAndExpiresAtLessThanEqual(user, now),
                refreshTokenRepo.countByUserAndRevokedTrue(user)
        );
    }

    // =========================== INTERNALS ===========================

    /**
     * Keeps the newest {@code maxActive} tokens (the one just issued always among them) and revokes the rest.
     */
    private void enforceMaxActive(User user, RefreshToken newest, Instant now, String ip) {
        List<RefreshToken> others = refreshTokenRepo
                .findAllByUserAndUsedFalseAndRevokedFalseAndExpiresAtAfter(user, now)
                .stream()
                .filter(t -> t != newest && !t.getTokenHash().equals(newest.getTokenHash()))
                .sorted(Comparator.comparing(RefreshToken::getIssuedAt).reversed())
                .toList();

        int keep = maxActive - 1;
        if (others.size() <= keep) return;

        for (int i = keep; i < others.size(); i++) {
            others.get(i).revoke(now, ip, REASON_LIMIT, null);
        }
        log.info("Revoked {} refresh token(s) over the limit for user={}", others.size() - keep, user.getId());
    }
}
