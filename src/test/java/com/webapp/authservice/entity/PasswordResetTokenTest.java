package com.webapp.authservice.entity;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PasswordResetTokenTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void singleUseWithinLifetime() {
        PasswordResetToken t = PasswordResetToken.builder()
                .tokenHash("c".repeat(64))
                .createdAt(NOW)
                .expiresAt(NOW.plus(Duration.ofHours(24)))
                .build();

        assertThat(t.isValid(NOW.plus(Duration.ofHours(23)))).isTrue();
        t.markUsed(NOW.plusSeconds(1));

        assertThat(t.isValid(NOW.plusSeconds(2))).isFalse();
        assertThat(t.getUsedAt()).isEqualTo(NOW.plusSeconds(1));
        assertThatThrownBy(() -> t.markUsed(NOW.plusSeconds(3))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void expiredTokenCannotBeUsed() {
        PasswordResetToken t = PasswordResetToken.builder()
                .tokenHash("d".repeat(64))
                .createdAt(NOW.minus(Duration.ofHours(25)))
                .expiresAt(NOW.minus(Duration.ofHours(1)))
                .build();

        assertThat(t.isValid(NOW)).isFalse();
        assertThatThrownBy(() -> t.markUsed(NOW)).isInstanceOf(IllegalStateException.class);
    }
}
