package com.webapp.authservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Server-side record of an issued refresh token.
 * Only the SHA-256 hex digest is stored; {@code replacedByTokenHash} links a rotated token to its successor.
 */
@Entity
@Table(
        name = "refresh_tokens",
        indexes = {
                @Index(name = "ix_refresh_user", columnList = "user_id"),
                @Index(name = "ix_refresh_session", columnList = "session_id"),
                @Index(name = "ix_refresh_token_hash", columnList = "token_hash", unique = true)
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RefreshToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token_hash", nullable = false, length = 64, unique = true)
    private String tokenHash;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    /** {@code jti} of the access token minted alongside this refresh token. */
    @Column(name = "jwt_id", length = 64)
    private String jwtId;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Builder.Default
    @Column(name = "used", nullable = false)
    private boolean used = false;

    @Builder.Default
    @Column(name = "revoked", nullable = false)
    private boolean revoked = false;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revoked_by_ip", length = 45)
    private String revokedByIp;

    @Column(name = "revoked_reason", length = 100)
    private String revokedReason;

    @Column(name = "replaced_by_token_hash", length = 64)
    private String replacedByTokenHash;

    @Column(name = "created_by_ip", length = 45)
    private String createdByIp;

    @Column(name = "user_agent", length = 255)
    private String userAgent;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isActive(Instant now) {
        return !used && !revoked && !isExpired(now);
    }

    public void markUsed(Instant now) {
        if (used) throw new IllegalStateException("Refresh token has already been used");
        if (revoked) throw new IllegalStateException("Refresh token has been revoked");
        if (isExpired(now)) throw new IllegalStateException("Refresh token has expired");
        used = true;
    }

    /** Keeps the first revocation's reason and timestamp; later calls only fill a missing successor. */
    public void revoke(Instant now, String ip, String reason, String replacedByHash) {
        if (!revoked) {
            revoked = true;
            revokedAt = now;
            revokedByIp = ip;
            revokedReason = reason;
        }
        if (replacedByHash != null && replacedByTokenHash == null) {
            replacedByTokenHash = replacedByHash;
        }
    }
}
