package com.webapp.authservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
        name = "user_sessions",
        indexes = {
                @Index(name = "ix_session_user", columnList = "user_id"),
                @Index(name = "ix_session_sid", columnList = "session_id", unique = true)
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, unique = true, length = 36)
    private String sessionId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 255)
    private String userAgent;

    @Column(name = "device_info", length = 100)
    private String deviceInfo;

    @Column(name = "location", length = 100)
    private String location;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;

    public boolean isValid(Instant now) {
        return active && now.isBefore(expiresAt);
    }

    public void touch(Instant now) {
        if (!active) throw new IllegalStateException("Cannot update activity on an ended session");
        lastActivityAt = now;
    }

    public void terminate(Instant now) {
        if (!active) return;
        active = false;
        endedAt = now;
    }
}
