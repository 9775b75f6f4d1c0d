package com.webapp.authservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A user-facing event record. An ARCHIVED notification always has {@code readAt} set.
 */
@Entity
@Table(
        name = "notifications",
        indexes = {
                @Index(name = "ix_notification_recipient_status", columnList = "recipient_id, status"),
                @Index(name = "ix_notification_expires", columnList = "expires_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification {

    @Id
    @UuidGenerator
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "id", length = 36, updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "recipient_id", nullable = false)
    private User recipient;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "trigger_user_id")
    private User triggerUser;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private NotificationType type;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private NotificationStatus status = NotificationStatus.UNREAD;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, length = 1000)
    private String message;

    @Column(name = "entity_type", length = 50)
    private String entityType;

    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "entity_id", length = 36)
    private UUID entityId;

    @Column(name = "action_url", length = 500)
    private String actionUrl;

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "notification_metadata", joinColumns = @JoinColumn(name = "notification_id"))
    @MapKeyColumn(name = "meta_key", length = 50)
    @Column(name = "meta_value", length = 255)
    private Map<String, String> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "archived_at")
    private Instant archivedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    /** Only an unread notification changes; read and archived ones keep their state. */
    public void markAsRead(Instant now) {
        if (status == NotificationStatus.UNREAD) {
            status = NotificationStatus.READ;
            readAt = now;
        }
    }

    public void markAsUnread() {
        status = NotificationStatus.UNREAD;
        readAt = null;
        archivedAt = null;
    }

    public void archive(Instant now) {
        status = NotificationStatus.ARCHIVED;
        archivedAt = now;
        if (readAt == null) {
            readAt = now;
        }
    }

    public void unarchive() {
        status = NotificationStatus.READ;
        archivedAt = null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
