package com.webapp.authservice.repository;

import com.webapp.authservice.config.ClockConfig;
import com.webapp.authservice.config.JpaConfig;
import com.webapp.authservice.entity.RefreshToken;
import com.webapp.authservice.dto.RefreshTokenUsageStats;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.service.UserSessionService;
import com.webapp.authservice.serviceImpl.RefreshTokenServiceImpl;
import com.webapp.authservice.support.TestUsers;
import com.webapp.authservice.utils.AuditorAwareImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DataJpaTest
@Import({JpaConfig.class, AuditorAwareImpl.class, ClockConfig.class})
class RefreshTokenRepositoryTest {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;
    @Autowired
    private UserRepository userRepository;

    private User user;

    @BeforeEach
    void setUp() {
        user = userRepository.saveAndFlush(TestUsers.unsaved("alice"));
    }

    private RefreshToken save(String hashSeed, Instant issuedAt, Instant expiresAt, boolean revoked) {
        RefreshToken token = RefreshToken.builder()
                .user(user)
                .tokenHash(hashSeed.repeat(64).substring(0, 64))
                .sessionId("session-1")
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .revoked(revoked)
                .build();
        return refreshTokenRepository.saveAndFlush(token);
    }

    @Test
    void activeQueryExcludesExpiredAndRevoked() {
        RefreshToken active = save("a", NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofDays(7)), false);
        save("b", NOW.minus(Duration.ofDays(8)), NOW.minus(Duration.ofDays(1)), false);
        save("c", NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofDays(7)), true);

        assertThat(refreshTokenRepository.findAllByUserAndUsedFalseAndRevokedFalseAndExpiresAtAfter(user, NOW))
                .extracting(RefreshToken::getTokenHash)
                .containsExactly(active.getTokenHash());
        assertThat(refreshTokenRepository.findAllBySessionIdAndUsedFalseAndRevokedFalseAndExpiresAtAfter("session-1", NOW))
                .hasSize(1);
        assertThat(refreshTokenRepository.countByUser(user)).isEqualTo(3);
        assertThat(refreshTokenRepository.countByUserAndRevokedTrue(user)).isEqualTo(1);
        assertThat(refreshTokenRepository.countByUserAndExpiresAtLessThanEqual(user, NOW)).isEqualTo(1);
    }

    @Test
    void usageStatsCountsARevokedExpiredTokenAsBothExpiredAndRevoked() {
        save("a", NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofDays(7)), false);
        save("b", NOW.minus(Duration.ofDays(8)), NOW.minus(Duration.ofDays(1)), false);
        save("c", NOW.minus(Duration.ofDays(9)), NOW.minus(Duration.ofDays(2)), true);
        save("d", NOW.minus(Duration.ofHours(3)), NOW.plus(Duration.ofDays(6)), true);
        RefreshToken rotated = save("e", NOW.minus(Duration.ofHours(2)), NOW.plus(Duration.ofDays(6)), false);
        rotated.markUsed(NOW);
        rotated.revoke(NOW, "203.0.113.7", "Replaced by new token", "f".repeat(64));
        refreshTokenRepository.saveAndFlush(rotated);

        RefreshTokenServiceImpl service = new RefreshTokenServiceImpl(
                refreshTokenRepository, mock(UserSessionService.class), Clock.fixed(NOW, ZoneOffset.UTC));

        RefreshTokenUsageStats stats = service.usageStats(user);

        assertThat(stats.total()).isEqualTo(5);
        assertThat(stats.active()).isEqualTo(1);
        assertThat(stats.expired()).isEqualTo(2);
        assertThat(stats.revoked()).isEqualTo(3);
    }

    @Test
    void sweepDeletesExpiredAndRetiredRowsOnly() {
        save("a", NOW.minus(Duration.ofMinutes(10)), NOW.plus(Duration.ofDays(7)), false);
        save("b", NOW.minus(Duration.ofDays(8)), NOW.minus(Duration.ofDays(1)), false);
        save("c", NOW.minus(Duration.ofHours(2)), NOW.plus(Duration.ofDays(6)), true);
        RefreshToken recentRevoked = save("d", NOW.minus(Duration.ofMinutes(5)), NOW.plus(Duration.ofDays(7)), true);

        int deleted = refreshTokenRepository.deleteExpiredOrRetired(NOW, NOW.minus(Duration.ofHours(1)));

        assertThat(deleted).isEqualTo(2);
        assertThat(refreshTokenRepository.findByTokenHash(recentRevoked.getTokenHash())).isPresent();
        assertThat(refreshTokenRepository.count()).isEqualTo(2);
    }
}
