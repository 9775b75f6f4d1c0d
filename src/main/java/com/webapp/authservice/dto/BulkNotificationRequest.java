package com.webapp.authservice.dto;

import com.webapp.authservice.entity.NotificationType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Same notification fanned out to many recipients; duplicate ids are collapsed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkNotificationRequest {

    @NotEmpty(message = "recipientIds must not be empty")
    @Size(max = 1000, message = "at most 1000 recipients per request")
    private List<UUID> recipientIds;

    private UUID triggerUserId;

    @NotNull(message = "type is required")
    private NotificationType type;

    @NotBlank(message = "title is required")
    @Size(max = 200, message = "title must be <= 200 characters")
    private String title;

    @NotBlank(message = "message is required")
    @Size(max = 1000, message = "message must be <= 1000 characters")
    private String message;

    @Size(max = 50)
    private String entityType;

    private UUID entityId;

    @Size(max = 500)
    private String actionUrl;

    @Size(max = 20, message = "at most 20 metadata entries")
    private Map<@Size(max = 50, message = "metadata keys must be <= 50 characters") String,
            @Size(max = 255, message = "metadata values must be <= 255 characters") String> metadata;

    private Instant expiresAt;
}
