package com.webapp.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.webapp.authservice.entity.Notification;
import com.webapp.authservice.entity.NotificationStatus;
import com.webapp.authservice.entity.NotificationType;
import com.webapp.authservice.entity.User;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationResponse {
    private UUID id;
    private UUID recipientId;
    private UUID triggerUserId;
    private String triggerUserName;
    private NotificationType type;
    private NotificationStatus status;
    private String title;
    private String message;
    private String entityType;
    private UUID entityId;
    private String actionUrl;
    private Map<String, String> metadata;
    private Instant createdAt;
    private Instant readAt;
    private Instant archivedAt;
    private Instant expiresAt;

    public static NotificationResponse from(Notification n) {
        User trigger = n.getTriggerUser();
        return NotificationResponse.builder()
                .id(n.getId())
                .recipientId(n.getRecipient().getId())
                .triggerUserId(trigger != null ? trigger.getId() : null)
                .triggerUserName(trigger != null ? trigger.getDisplayName() : null)
                .type(n.getType())
                .status(n.getStatus())
                .title(n.getTitle())
                .message(n.getMessage())
                .entityType(n.getEntityType())
                .entityId(n.getEntityId())
                .actionUrl(n.getActionUrl())
                .metadata(n.getMetadata() == null ? Map.of() : Map.copyOf(n.getMetadata()))
                .createdAt(n.getCreatedAt())
                .readAt(n.getReadAt())
                .archivedAt(n.getArchivedAt())
                .expiresAt(n.getExpiresAt())
                .build();
    }
}
