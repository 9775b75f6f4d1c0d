package com.webapp.authservice.scheduler;

import com.webapp.authservice.service.NotificationService;
import com.webapp.authservice.service.PasswordResetService;
import com.webapp.authservice.service.RefreshTokenService;
import com.webapp.authservice.service.UserSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.function.IntSupplier;

/**
 * Periodic sweep of expired security records and stale notifications.
 * Each sweep runs on its own; one failing does not skip the rest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "housekeeping.enabled", havingValue = "true", matchIfMissing = true)
public class HousekeepingScheduler {

    private final RefreshTokenService refreshTokenService;
    private final PasswordResetService passwordResetService;
    private final UserSessionService userSessionService;
    private final NotificationService notificationService;
    private final Clock clock;

    @Value("${notification.archived-retention-days:90}")
    private int archivedRetentionDays = 90;

    @Scheduled(cron = "${housekeeping.cron:0 0 * * * *}")
    public void run() {
        Instant now = clock.instant();
        int tokens = sweep("refresh tokens", () -> refreshTokenService.purgeExpiredAndRevoked(now));
        int resets = sweep("reset tokens", () -> passwordResetService.purgeExpired(now));
        int sessions = sweep("sessions", () -> userSessionService.purgeExpired(now));
        int expired = sweep("expired notifications", () -> notificationService.cleanupExpired(now));
        int archived = sweep("archived notifications",
                () -> notificationService.cleanupArchivedOlderThan(archivedRetentionDays, now));

        log.info("Housekeeping done: refreshTokens={} resetTokens={} sessions={} expiredNotifications={} archivedNotifications={}",
                tokens, resets, sessions, expired, archived);
    }

    /** Returns the deleted count, or -1 when the sweep failed. */
    private int sweep(String name, IntSupplier task) {
        try {
            return task.getAsInt();
        } catch (RuntimeException e) {
            log.warn("Housekeeping sweep '{}' failed", name, e);
            return -1;
        }
    }
}
