package com.webapp.authservice.service;

import com.webapp.authservice.dto.ClientContext;
import com.webapp.authservice.dto.IssuedRefreshToken;
import com.webapp.authservice.dto.RefreshTokenUsageStats;
import com.webapp.authservice.entity.RefreshToken;
import com.webapp.authservice.entity.User;

import java.time.Instant;
import java.util.Optional;

public interface RefreshTokenService {

    /** Issue a refresh token bound to (user, session), then enforce the per-user cap. */
    IssuedRefreshToken issue(User user, String sessionId, String jwtId, ClientContext client);

    Optional<RefreshToken> findActive(String rawToken);

    /**
     * Consume {@code rawToken} and issue its successor in the same session.
     * Presenting an already-rotated token revokes the whole session.
     */
    RotatedRefreshToken rotate(String rawToken, ClientContext client);

    /** Records the access token minted alongside an already-issued refresh token. */
    void bindAccessToken(String rawToken, String jwtId);

    /** Revoke the token only if it belongs to {@code user}. */
    boolean revoke(User user, String rawToken, String ip, String reason);

    int revokeAllForUser(User user, String ip, String reason);

    int revokeAllForSession(String sessionId, String ip, String reason);

    /** Housekeeping: delete expired rows and retired rows past retention. */
    int purgeExpiredAndRevoked(Instant now);

    RefreshTokenUsageStats usageStats(User user);

    /** Outcome of a rotation: the new token and the user it belongs to. */
    record RotatedRefreshToken(User user, IssuedRefreshToken token) {}
}
