package com.webapp.authservice.service;

import com.webapp.authservice.dto.ClientContext;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.entity.UserSession;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface UserSessionService {

    UserSession create(User user, Duration lifetime, ClientContext client);

    Optional<UserSession> findValid(String sessionId);

    /** Any session with this id, valid or not. */
    Optional<UserSession> findBySessionId(String sessionId);

    /** Records activity on a valid session. False when the session is unknown, ended or expired. */
    boolean touch(String sessionId);

    boolean terminate(String sessionId);

    int terminateAllForUser(User user);

    List<UserSession> listActive(User user);

    int purgeExpired(Instant now);
}
