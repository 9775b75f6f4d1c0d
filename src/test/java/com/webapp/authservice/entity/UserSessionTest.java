package com.webapp.authservice.entity;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserSessionTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private UserSession session() {
        return UserSession.builder()
                .sessionId("s-1")
                .createdAt(NOW)
                .lastActivityAt(NOW)
                .expiresAt(NOW.plus(Duration.ofDays(1)))
                .build();
    }

    @Test
    void validUntilExpiryWhileActive() {
        UserSession s = session();
        assertThat(s.isValid(NOW)).isTrue();
        assertThat(s.isValid(NOW.plus(Duration.ofDays(1)))).isFalse();
    }

    @Test
    void touchUpdatesActivityAndFailsOnceEnded() {
        UserSession s = session();
        s.touch(NOW.plusSeconds(120));
        assertThat(s.getLastActivityAt()).isEqualTo(NOW.plusSeconds(120));

        s.terminate(NOW.plusSeconds(300));
        assertThatThrownBy(() -> s.touch(NOW.plusSeconds(400))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void terminateIsIdempotent() {
        UserSession s = session();
        s.terminate(NOW.plusSeconds(10));
        s.terminate(NOW.plusSeconds(20));

        assertThat(s.isActive()).isFalse();
        assertThat(s.getEndedAt()).isEqualTo(NOW.plusSeconds(10));
        assertThat(s.isValid(NOW.plusSeconds(30))).isFalse();
    }
}
