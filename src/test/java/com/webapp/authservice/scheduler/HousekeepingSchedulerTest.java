package com.webapp.authservice.scheduler;

import com.webapp.authservice.service.NotificationService;
import com.webapp.authservice.service.PasswordResetService;
import com.webapp.authservice.service.RefreshTokenService;
import com.webapp.authservice.service.UserSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HousekeepingSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private RefreshTokenService refreshTokenService;
    @Mock
    private PasswordResetService passwordResetService;
    @Mock
    private UserSessionService userSessionService;
    @Mock
    private NotificationService notificationService;

    private HousekeepingScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new HousekeepingScheduler(refreshTokenService, passwordResetService, userSessionService,
                notificationService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void runsEverySweepWithTheSameInstant() {
        scheduler.run();

        verify(refreshTokenService).purgeExpiredAndRevoked(NOW);
        verify(passwordResetService).purgeExpired(NOW);
        verify(userSessionService).purgeExpired(NOW);
        verify(notificationService).cleanupExpired(NOW);
        verify(notificationService).cleanupArchivedOlderThan(90, NOW);
    }

    @Test
    void failingSweepDoesNotStopTheOthers() {
        when(refreshTokenService.purgeExpiredAndRevoked(NOW)).thenThrow(new QueryTimeoutException("slow"));

        scheduler.run();

        verify(passwordResetService).purgeExpired(NOW);
        verify(userSessionService).purgeExpired(NOW);
        verify(notificationService).cleanupArchivedOlderThan(90, NOW);
    }
}
