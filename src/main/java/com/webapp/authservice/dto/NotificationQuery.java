package com.webapp.authservice.dto;

import com.webapp.authservice.entity.NotificationStatus;
import com.webapp.authservice.entity.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Listing filters bound from query parameters. Null filters match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationQuery {

    private NotificationType type;
    private NotificationStatus status;
    private boolean includeExpired;

    @Builder.Default
    private int page = 0;

    @Builder.Default
    private int size = 20;

    @Builder.Default
    private String sortBy = "createdAt";

    @Builder.Default
    private String sortDirection = "desc";
}
