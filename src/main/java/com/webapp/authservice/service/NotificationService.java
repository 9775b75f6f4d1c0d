package com.webapp.authservice.service;

import com.webapp.authservice.dto.BulkNotificationRequest;
import com.webapp.authservice.dto.CreateNotificationRequest;
import com.webapp.authservice.dto.NotificationQuery;
import com.webapp.authservice.dto.NotificationResponse;
import com.webapp.authservice.dto.NotificationStats;
import com.webapp.authservice.entity.NotificationType;
import com.webapp.authservice.entity.User;
import org.springframework.data.domain.Page;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NotificationService {

    NotificationResponse create(CreateNotificationRequest request);

    List<NotificationResponse> createBulk(BulkNotificationRequest request);

    NotificationResponse get(User user, UUID id);

    void delete(User user, UUID id);

    Page<NotificationResponse> list(User user, NotificationQuery query);

    NotificationStats stats(User user);

    NotificationResponse markAsRead(User user, UUID id);

    NotificationResponse markAsUnread(User user, UUID id);

    NotificationResponse archive(User user, UUID id);

    NotificationResponse unarchive(User user, UUID id);

    int markAllAsRead(User user, NotificationType type, Instant olderThan);

    int archiveAll(User user, NotificationType type, Instant olderThan);

    List<NotificationResponse> unread(User user, int limit);

    long unreadCount(User user);

    // Domain-event creators; empty when the trigger user is the recipient.

    Optional<NotificationResponse> notifyLike(UUID recipientId, UUID postId, UUID triggerUserId);

    Optional<NotificationResponse> notifyComment(UUID recipientId, UUID postId, UUID commentId, UUID triggerUserId);

    Optional<NotificationResponse> notifyFollow(UUID recipientId, UUID triggerUserId);

    Optional<NotificationResponse> notifyMention(UUID recipientId, UUID postId, UUID triggerUserId);

    int cleanupExpired(Instant now);

    int cleanupArchivedOlderThan(int days, Instant now);
}
