package com.webapp.authservice.serviceImpl;

import com.webapp.authservice.dto.ClientContext;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.entity.UserSession;
import com.webapp.authservice.repository.UserSessionRepository;
import com.webapp.authservice.support.TestUsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserSessionServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private UserSessionRepository sessionRepository;

    private UserSessionServiceImpl sessionService;
    private User user;

    @BeforeEach
    void setUp() {
        sessionService = new UserSessionServiceImpl(sessionRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        user = TestUsers.confirmed("alice");
    }

    private UserSession session(String id, Instant lastActivity) {
        return UserSession.builder()
                .sessionId(id)
                .user(user)
                .createdAt(NOW.minus(Duration.ofHours(1)))
                .lastActivityAt(lastActivity)
                .expiresAt(NOW.plus(Duration.ofDays(1)))
                .build();
    }

    @Test
    void createRecordsClientAndLifetime() {
        when(sessionRepository.save(any(UserSession.class))).then(returnsFirstArg());
        ClientContext client = ClientContext.builder()
                .ipAddress("203.0.113.7").userAgent("curl/8").deviceInfo("Unknown").location("Oslo").build();

        UserSession created = sessionService.create(user, Duration.ofDays(30), client);

        assertThat(created.getSessionId()).hasSize(36);
        assertThat(created.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
        assertThat(created.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(created.getLocation()).isEqualTo("Oslo");
        assertThat(created.isActive()).isTrue();
    }

    @Test
    void touchWithinGranularityDoesNotRewriteActivity() {
        UserSession recent = session("s-1", NOW.minusSeconds(30));
        when(sessionRepository.findBySessionId("s-1")).thenReturn(Optional.of(recent));

        assertThat(sessionService.touch("s-1")).isTrue();
        assertThat(recent.getLastActivityAt()).isEqualTo(NOW.minusSeconds(30));
    }

    @Test
    void touchAfterGranularityRecordsActivity() {
        UserSession stale = session("s-1", NOW.minus(Duration.ofMinutes(5)));
        when(sessionRepository.findBySessionId("s-1")).thenReturn(Optional.of(stale));

        assertThat(sessionService.touch("s-1")).isTrue();
        assertThat(stale.getLastActivityAt()).isEqualTo(NOW);
    }

    @Test
    void endedSessionCannotBeTouchedOrFound() {
        UserSession ended = session("s-1", NOW.minusSeconds(600));
        ended.terminate(NOW.minusSeconds(60));
        when(sessionRepository.findBySessionId("s-1")).thenReturn(Optional.of(ended));

        assertThat(sessionService.touch("s-1")).isFalse();
        assertThat(sessionService.findValid("s-1")).isEmpty();
        assertThat(sessionService.terminate("s-1")).isFalse();
    }

    @Test
    void terminateAllEndsEveryActiveSession() {
        UserSession a = session("s-1", NOW);
        UserSession b = session("s-2", NOW);
        when(sessionRepository.findAllByUserAndActiveTrue(user)).thenReturn(List.of(a, b));

        assertThat(sessionService.terminateAllForUser(user)).isEqualTo(2);
        assertThat(a.isActive()).isFalse();
        assertThat(b.getEndedAt()).isEqualTo(NOW);
    }

    @Test
    void purgeKeepsEndedSessionsForRetentionWindow() {
        when(sessionRepository.deleteExpiredOrEnded(NOW, NOW.minus(Duration.ofDays(30)))).thenReturn(3);

        assertThat(sessionService.purgeExpired(NOW)).isEqualTo(3);
    }

    @Test
    void blankIdsShortCircuit() {
        assertThat(sessionService.findValid(" ")).isEmpty();
        assertThat(sessionService.touch(null)).isFalse();
        verifyNoInteractions(sessionRepository);
    }
}
