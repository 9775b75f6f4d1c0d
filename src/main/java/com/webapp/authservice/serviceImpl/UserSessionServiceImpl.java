package com.webapp.authservice.serviceImpl;

import com.webapp.authservice.dto.ClientContext;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.entity.UserSession;
import com.webapp.authservice.repository.UserSessionRepository;
import com.webapp.authservice.service.UserSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Server-side sessions. Access and refresh tokens carry a session id and stop working once it ends.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserSessionServiceImpl implements UserSessionService {

    private final UserSessionRepository sessionRepository;
    private final Clock clock;

    /** Minimum gap between two lastActivityAt writes for the same session. */
    @Value("${session.activity-granularity:PT1M}")
    private Duration activityGranularity = Duration.ofMinutes(1);

    @Value("${session.retention.days:30}")
    private long retentionDays = 30;

    @Override
    @Transactional
    public UserSession create(User user, Duration lifetime, ClientContext client) {
        Instant now = clock.instant();
        ClientContext ctx = client != null ? client : ClientContext.unknown();
        UserSession session = UserSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .user(user)
                .ipAddress(ctx.getIpAddress())
                .userAgent(ctx.getUserAgent())
                .deviceInfo(ctx.getDeviceInfo())
                .location(ctx.getLocation())
                .createdAt(now)
                .lastActivityAt(now)
                .expiresAt(now.plus(lifetime))
                .active(true)
                .build();
        UserSession saved = sessionRepository.save(session);
        log.debug("Session {} created for user={} lifetime={}", saved.getSessionId(), user.getId(), lifetime);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserSession> findValid(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) return Optional.empty();
        Instant now = clock.instant();
        return sessionRepository.findBySessionId(sessionId).filter(s -> s.isValid(now));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserSession> findBySessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) return Optional.empty();
        return sessionRepository.findBySessionId(sessionId);
    }

    @Override
    @Transactional
    public boolean touch(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) return false;
        Instant now = clock.instant();
        Optional<UserSession> found = sessionRepository.findBySessionId(sessionId).filter(s -> s.isValid(now));
        if (found.isEmpty()) return false;

        UserSession session = found.get();
        if (session.getLastActivityAt() == null
                || !session.getLastActivityAt().plus(activityGranularity).isAfter(now)) {
            session.touch(now);
        }
        return true;
    }

    @Override
    @Transactional
    public boolean terminate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) return false;
        Instant now = clock.instant();
        return sessionRepository.findBySessionId(sessionId)
                .filter(UserSession::isActive)
                .map(s -> {
                    s.terminate(now);
                    log.debug("Session {} terminated", sessionId);
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public int terminateAllForUser(User user) {
        Instant now = clock.instant();
        List<UserSession> active = sessionRepository.findAllByUserAndActiveTrue(user);
        active.forEach(s -> s.terminate(now));
        if (!active.isEmpty()) {
            log.info("Terminated {} session(s) for user={}", active.size(), user.getId());
        }
        return active.size();
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserSession> listActive(User user) {
        return sessionRepository.findAllByUserAndActiveTrueAndExpiresAtAfterOrderByLastActivityAtDesc(
                user, clock.instant());
    }

    @Override
    @Transactional
    public int purgeExpired(Instant now) {
        return sessionRepository.deleteExpiredOrEnded(now, now.minus(retentionDays, ChronoUnit.DAYS));
    }
}
