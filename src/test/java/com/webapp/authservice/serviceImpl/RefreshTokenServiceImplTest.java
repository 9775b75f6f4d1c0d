package com.webapp.authservice.serviceImpl;

import com.webapp.authservice.dto.ClientContext;
import com.webapp.authservice.dto.IssuedRefreshToken;
import com.webapp.authservice.dto.RefreshTokenUsageStats;
import com.webapp.authservice.entity.RefreshToken;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.entity.UserSession;
import com.webapp.authservice.exception.AuthExceptions;
import com.webapp.authservice.repository.RefreshTokenRepository;
import com.webapp.authservice.service.RefreshTokenService.RotatedRefreshToken;
import com.webapp.authservice.service.UserSessionService;
import com.webapp.authservice.support.TestUsers;
import com.webapp.authservice.utils.TokenHashing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefreshTokenServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String RAW = "raw-refresh-token";
    private static final ClientContext CLIENT = ClientContext.builder().ipAddress("203.0.113.7").build();

    @Mock
    private RefreshTokenRepository refreshTokenRepo;
    @Mock
    private UserSessionService userSessionService;

    private RefreshTokenServiceImpl refreshTokenService;
    private User user;

    @BeforeEach
    void setUp() {
        refreshTokenService = new RefreshTokenServiceImpl(refreshTokenRepo, userSessionService, Clock.fixed(NOW, ZoneOffset.UTC));
        user = TestUsers.confirmed("alice");
    }

    private RefreshToken stored(String raw, Instant issuedAt) {
        return RefreshToken.builder()
                .user(user)
                .tokenHash(TokenHashing.sha256Hex(raw))
                .sessionId("session-1")
                .issuedAt(issuedAt)
                .expiresAt(issuedAt.plus(Duration.ofDays(7)))
                .build();
    }

    @Test
    void issueStoresOnlyTheHash() {
        IssuedRefreshToken issued = refreshTokenService.issue(user, "session-1", "jti-1", CLIENT);

        ArgumentCaptor<RefreshToken> captor = ArgumentCaptor.forClass(RefreshToken.class);
        verify(refreshTokenRepo).save(captor.capture());
        RefreshToken saved = captor.getValue();

        assertThat(saved.getTokenHash()).isEqualTo(TokenHashing.sha256Hex(issued.raw())).isNotEqualTo(issued.raw());
        assertThat(saved.getJwtId()).isEqualTo("jti-1");
        assertThat(saved.getCreatedByIp()).isEqualTo("203.0.113.7");
        assertThat(saved.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
        assertThat(issued.sessionId()).isEqualTo("session-1");
    }

    @Test
    @DisplayName("issuing past the per-user cap revokes the oldest active token")
    void issueRevokesOldestBeyondCap() {
        List<RefreshToken> existing = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            existing.add(stored("old-" + i, NOW.minus(Duration.ofHours(i))));
        }
        when(refreshTokenRepo.findAllByUserAndUsedFalseAndRevokedFalseAndExpiresAtAfter(user, NOW)).thenReturn(existing);

        refreshTokenService.issue(user, "session-1", null, CLIENT);

        RefreshToken oldest = existing.get(4);
        assertThat(oldest.isRevoked()).isTrue();
        assertThat(oldest.getRevokedReason()).isEqualTo(RefreshTokenServiceImpl.REASON_LIMIT);
        assertThat(existing.subList(0, 4)).noneMatch(RefreshToken::isRevoked);
    }

    @Test
    void rotateSpendsCurrentAndLinksSuccessor() {
        RefreshToken current = stored(RAW, NOW.minus(Duration.ofHours(1)));
        when(refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(RAW))).thenReturn(Optional.of(current));
        when(userSessionService.findValid("session-1")).thenReturn(Optional.of(new UserSession()));

        RotatedRefreshToken rotated = refreshTokenService.rotate(RAW, CLIENT);

        assertThat(rotated.user()).isSameAs(user);
        assertThat(rotated.token().sessionId()).isEqualTo("session-1");
        assertThat(current.isUsed()).isTrue();
        assertThat(current.isRevoked()).isTrue();
        assertThat(current.getRevokedReason()).isEqualTo(RefreshTokenServiceImpl.REASON_REPLACED);
        assertThat(current.getReplacedByTokenHash()).isEqualTo(TokenHashing.sha256Hex(rotated.token().raw()));
    }

    @Test
    @DisplayName("presenting a rotated token revokes the session")
    void reuseOfRotatedTokenRevokesSession() {
        RefreshToken spent = stored(RAW, NOW.minus(Duration.ofHours(2)));
        spent.markUsed(NOW.minus(Duration.ofHours(1)));
        spent.revoke(NOW.minus(Duration.ofHours(1)), null, RefreshTokenServiceImpl.REASON_REPLACED, "f".repeat(64));
        RefreshToken successor = stored("successor", NOW.minus(Duration.ofHours(1)));
        when(refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(RAW))).thenReturn(Optional.of(spent));
        when(refreshTokenRepo.findAllBySessionIdAndUsedFalseAndRevokedFalseAndExpiresAtAfter("session-1", NOW))
                .thenReturn(List.of(successor));

        assertThatThrownBy(() -> refreshTokenService.rotate(RAW, CLIENT))
                .isInstanceOf(AuthExceptions.InvalidRefreshToken.class);

        assertThat(successor.isRevoked()).isTrue();
        assertThat(successor.getRevokedReason()).isEqualTo(RefreshTokenServiceImpl.REASON_REUSE);
        verify(userSessionService).terminate("session-1");
        verify(refreshTokenRepo, never()).save(any());
    }

    @Test
    void revokedTokenWithoutSuccessorIsSimplyRejected() {
        RefreshToken revoked = stored(RAW, NOW.minus(Duration.ofHours(1)));
        revoked.revoke(NOW, null, "Logged out", null);
        when(refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(RAW))).thenReturn(Optional.of(revoked));

        assertThatThrownBy(() -> refreshTokenService.rotate(RAW, CLIENT))
                .isInstanceOf(AuthExceptions.InvalidRefreshToken.class)
                .hasMessage("Refresh token has been revoked.");
        verifyNoInteractions(userSessionService);
    }

    @Test
    void unknownBlankOrExpiredTokensAreRejected() {
        assertThatThrownBy(() -> refreshTokenService.rotate(" ", CLIENT))
                .isInstanceOf(AuthExceptions.InvalidRefreshToken.class);

        assertThatThrownBy(() -> refreshTokenService.rotate("unknown", CLIENT))
                .isInstanceOf(AuthExceptions.InvalidRefreshToken.class)
                .hasMessage("Invalid refresh token.");

        RefreshToken expired = stored(RAW, NOW.minus(Duration.ofDays(8)));
        when(refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(RAW))).thenReturn(Optional.of(expired));
        assertThatThrownBy(() -> refreshTokenService.rotate(RAW, CLIENT))
                .isInstanceOf(AuthExceptions.InvalidRefreshToken.class)
                .hasMessage("Refresh token has expired.");
    }

    @Test
    void tokenOfEndedSessionIsRevoked() {
        RefreshToken current = stored(RAW, NOW.minus(Duration.ofHours(1)));
        when(refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(RAW))).thenReturn(Optional.of(current));
        when(userSessionService.findValid("session-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> refreshTokenService.rotate(RAW, CLIENT))
                .isInstanceOf(AuthExceptions.InvalidRefreshToken.class);

        assertThat(current.isUsed()).isFalse();
        assertThat(current.getRevokedReason()).isEqualTo(RefreshTokenServiceImpl.REASON_SESSION_ENDED);
    }

    @Test
    void revokeIgnoresTokensOwnedBySomeoneElse() {
        RefreshToken current = stored(RAW, NOW.minus(Duration.ofHours(1)));
        when(refreshTokenRepo.findByTokenHash(TokenHashing.sha256Hex(RAW))).thenReturn(Optional.of(current));

        assertThat(refreshTokenService.revoke(TestUsers.confirmed("mallory"), RAW, null, "Logged out")).isFalse();
        assertThat(current.isRevoked()).isFalse();

        assertThat(refreshTokenService.revoke(user, RAW, null, "Logged out")).isTrue();
        assertThat(current.getRevokedReason()).isEqualTo("Logged out");
    }

    @Test
    void purgeUsesRetentionCutoff() {
        when(refreshTokenRepo.deleteExpiredOrRetired(NOW, NOW.minus(Duration.ofDays(30)))).thenReturn(4);

        assertThat(refreshTokenService.purgeExpiredAndRevoked(NOW)).isEqualTo(4);
    }

    @Test
    void usageStatsReadsEachBucketAtTheServiceClock() {
        when(refreshTokenRepo.countByUser(user)).thenReturn(6L);
        when(refreshTokenRepo.countByUserAndUsedFalseAndRevokedFalseAndExpiresAtAfter(user, NOW)).thenReturn(2L);
        when(refreshTokenRepo.countByUserAndExpiresAtLessThanEqual(user, NOW)).thenReturn(3L);
        when(refreshTokenRepo.countByUserAndRevokedTrue(user)).thenReturn(4L);

        assertThat(refreshTokenService.usageStats(user)).isEqualTo(new RefreshTokenUsageStats(6, 2, 3, 4));
    }
}
