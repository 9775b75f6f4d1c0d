package com.webapp.authservice.controller;

import com.webapp.authservice.dto.*;
import com.webapp.authservice.entity.NotificationStatus;
import com.webapp.authservice.entity.NotificationType;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.exception.RequestExceptions;
import com.webapp.authservice.service.NotificationService;
import com.webapp.authservice.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/notifications")
@RequiredArgsConstructor
@Tag(name = "Notifications")
public class NotificationController {

    private final NotificationService notificationService;
    private final Clock clock;

    @GetMapping
    public Page<NotificationResponse> list(@AuthenticationPrincipal User user,
                                           @RequestParam(required = false) NotificationType type,
                                           @RequestParam(required = false) NotificationStatus status,
                                           @RequestParam(defaultValue = "false") boolean includeExpired,
                                           @RequestParam(defaultValue = "0") int page,
                                           @RequestParam(defaultValue = "20") int size,
                                           @RequestParam(defaultValue = "createdAt") String sortBy,
                                           @RequestParam(defaultValue = "desc") String sortDirection) {
        NotificationQuery query = NotificationQuery.builder()
                .type(type)
                .status(status)
                .includeExpired(includeExpired)
                .page(page)
                .size(size)
                .sortBy(sortBy)
                .sortDirection(sortDirection)
                .build();
        return notificationService.list(user, query);
    }

    @GetMapping("/stats")
    public NotificationStats stats(@AuthenticationPrincipal User user) {
        return notificationService.stats(user);
    }

    @GetMapping("/unread")
    public List<NotificationResponse> unread(@AuthenticationPrincipal User user,
                                             @RequestParam(defaultValue = "20") int limit) {
        return notificationService.unread(user, limit);
    }

    @GetMapping("/unread-count")
    public Map<String, Long> unreadCount(@AuthenticationPrincipal User user) {
        return Map.of("count", notificationService.unreadCount(user));
    }

    @GetMapping("/{id}")
    public NotificationResponse get(@AuthenticationPrincipal User user, @PathVariable UUID id) {
        return notificationService.get(user, id);
    }

    @PostMapping
    @ResponseMessage("Notification created")
    public ResponseEntity<NotificationResponse> create(@Valid @RequestBody CreateNotificationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(notificationService.create(request));
    }

    @PostMapping("/bulk")
    @ResponseMessage("Notifications created")
    public ResponseEntity<List<NotificationResponse>> createBulk(@Valid @RequestBody BulkNotificationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(notificationService.createBulk(request));
    }

    // Domain events from other services; 204 when the actor is the recipient and nothing is stored.

    @PostMapping("/like")
    @ResponseMessage("Notification created")
    public ResponseEntity<NotificationResponse> like(@Valid @RequestBody NotificationEventRequest request) {
        return created(notificationService.notifyLike(
                request.getRecipientId(), require(request.getPostId(), "postId"), request.getTriggerUserId()));
    }

    @PostMapping("/comment")
    @ResponseMessage("Notification created")
    public ResponseEntity<NotificationResponse> comment(@Valid @RequestBody NotificationEventRequest request) {
        return created(notificationService.notifyComment(
                request.getRecipientId(),
                require(request.getPostId(), "postId"),
                require(request.getCommentId(), "commentId"),
                request.getTriggerUserId()));
    }

    @PostMapping("/follow")
    @ResponseMessage("Notification created")
    public ResponseEntity<NotificationResponse> follow(@Valid @RequestBody NotificationEventRequest request) {
        return created(notificationService.notifyFollow(request.getRecipientId(), request.getTriggerUserId()));
    }

    @PostMapping("/mention")
    @ResponseMessage("Notification created")
    public ResponseEntity<NotificationResponse> mention(@Valid @RequestBody NotificationEventRequest request) {
        return created(notificationService.notifyMention(
                request.getRecipientId(), require(request.getPostId(), "postId"), request.getTriggerUserId()));
    }

    @PatchMapping("/{id}/read")
    public NotificationResponse markAsRead(@AuthenticationPrincipal User user, @PathVariable UUID id) {
        return notificationService.markAsRead(user, id);
    }

    @PatchMapping("/{id}/unread")
    public NotificationResponse markAsUnread(@AuthenticationPrincipal User user, @PathVariable UUID id) {
        return notificationService.markAsUnread(user, id);
    }

    @PatchMapping("/{id}/archive")
    public NotificationResponse archive(@AuthenticationPrincipal User user, @PathVariable UUID id) {
        return notificationService.archive(user, id);
    }

    @PatchMapping("/{id}/unarchive")
    public NotificationResponse unarchive(@AuthenticationPrincipal User user, @PathVariable UUID id) {
        return notificationService.unarchive(user, id);
    }

    @PatchMapping("/read-all")
    public Map<String, Integer> markAllAsRead(@AuthenticationPrincipal User user,
                                              @RequestParam(required = false) NotificationType type,
                                              @RequestParam(required = false)
                                              @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant olderThan) {
        return Map.of("updated", notificationService.markAllAsRead(user, type, olderThan));
    }

    @PatchMapping("/archive-all")
    public Map<String, Integer> archiveAll(@AuthenticationPrincipal User user,
                                           @RequestParam(required = false) NotificationType type,
                                           @RequestParam(required = false)
                                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant olderThan) {
        return Map.of("updated", notificationService.archiveAll(user, type, olderThan));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal User user, @PathVariable UUID id) {
        notificationService.delete(user, id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/expired")
    @Operation(summary = "Purge expired notifications now instead of waiting for housekeeping")
    public Map<String, Integer> cleanupExpired() {
        return Map.of("deleted", notificationService.cleanupExpired(clock.instant()));
    }

    @DeleteMapping("/archived")
    @Operation(summary = "Purge notifications archived more than daysOld days ago")
    public Map<String, Integer> cleanupArchived(@RequestParam(defaultValue = "90") int daysOld) {
        if (daysOld < 1) {
            throw new RequestExceptions.InvalidParameter("daysOld must be at least 1.");
        }
        return Map.of("deleted", notificationService.cleanupArchivedOlderThan(daysOld, clock.instant()));
    }

    // =========================== INTERNALS ===========================

    private static ResponseEntity<NotificationResponse> created(Optional<NotificationResponse> notification) {
        return notification
                .map(body -> ResponseEntity.status(HttpStatus.CREATED).body(body))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    private static UUID require(UUID value, String name) {
        if (value == null) {
            throw new RequestExceptions.InvalidParameter(name + " is required.");
        }
        return value;
    }
}
