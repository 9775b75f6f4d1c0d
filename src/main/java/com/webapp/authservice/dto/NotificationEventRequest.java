package com.webapp.authservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A like, comment, follow or mention reported by another service.
 * {@code postId} is required for all but follow, {@code commentId} only for comment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationEventRequest {

    @NotNull(message = "recipientId is required")
    private UUID recipientId;

    @NotNull(message = "triggerUserId is required")
    private UUID triggerUserId;

    private UUID postId;

    private UUID commentId;
}
