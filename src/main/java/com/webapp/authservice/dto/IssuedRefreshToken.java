package com.webapp.authservice.dto;

import java.time.Instant;

/**
 * A refresh token as handed to the client. {@code raw} exists only here; the store keeps its hash.
 */
public record IssuedRefreshToken(String raw, Instant expiresAt, String sessionId) {
}
