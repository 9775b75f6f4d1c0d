package com.webapp.authservice.dto;

import com.webapp.authservice.entity.NotificationType;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class NotificationStats {
    private long total;
    private long unread;
    private long read;
    private long archived;
    private Map<NotificationType, Long> byType;
}
