package com.webapp.authservice.SecurityConfig;

import java.time.Instant;

/**
 * Token facts attached to the {@code Authentication} so handlers can act on the current session
 * without re-parsing the bearer token.
 */
public record JwtAuthenticationDetails(String accessToken,
                                       String sessionId,
                                       String jwtId,
                                       Instant expiresAt,
                                       String remoteAddress) {
}
