package com.webapp.authservice.serviceImpl;

import com.webapp.authservice.dto.BulkNotificationRequest;
import com.webapp.authservice.dto.CreateNotificationRequest;
import com.webapp.authservice.dto.NotificationQuery;
import com.webapp.authservice.dto.NotificationResponse;
import com.webapp.authservice.dto.NotificationStats;
import com.webapp.authservice.entity.Notification;
import com.webapp.authservice.entity.NotificationStatus;
import com.webapp.authservice.entity.NotificationType;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.exception.RequestExceptions;
import com.webapp.authservice.exception.ResourceExceptions;
import com.webapp.authservice.exception.UserExceptions;
import com.webapp.authservice.repository.NotificationRepository;
import com.webapp.authservice.repository.NotificationRepository.StatusTypeCount;
import com.webapp.authservice.repository.UserRepository;
import com.webapp.authservice.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationServiceImpl implements NotificationService {

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;
    private static final Set<String> SORTABLE_FIELDS = Set.of("createdAt", "readAt", "type");
    private static final String FALLBACK_NAME = "Someone";

    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    // ============================== CREATE ==============================

    @Override
    @Transactional
    public NotificationResponse create(CreateNotificationRequest request) {
        Instant now = clock.instant();
        requireFutureExpiry(request.getExpiresAt(), now);

        User recipient = findUser(request.getRecipientId());
        User trigger = request.getTriggerUserId() != null ? findUser(request.getTriggerUserId()) : null;

        Notification saved = notificationRepository.save(Notification.builder()
                .recipient(recipient)
                .triggerUser(trigger)
                .type(request.getType())
                .title(request.getTitle())
                .message(request.getMessage())
                .entityType(request.getEntityType())
                .entityId(request.getEntityId())
                .actionUrl(request.getActionUrl())
                .metadata(copyOf(request.getMetadata()))
                .createdAt(now)
                .expiresAt(request.getExpiresAt())
                .build());
        log.debug("Notification {} created type={} recipient={}", saved.getId(), saved.getType(), recipient.getId());
        return NotificationResponse.from(saved);
    }

    @Override
    @Transactional
    public List<NotificationResponse> createBulk(BulkNotificationRequest request) {
        Instant now = clock.instant();
        requireFutureExpiry(request.getExpiresAt(), now);

        User trigger = request.getTriggerUserId() != null ? findUser(request.getTriggerUserId()) : null;
        Set<UUID> recipientIds = new LinkedHashSet<>(request.getRecipientIds());
        recipientIds.remove(null);
        Map<UUID, User> recipients = userRepository.findAllById(recipientIds).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));

        List<Notification> batch = new ArrayList<>(recipientIds.size());
        for (UUID id : recipientIds) {
            User recipient = recipients.get(id);
            if (recipient == null) {
                log.warn("Skipping bulk notification for unknown recipient {}", id);
                continue;
            }
            batch.add(Notification.builder()
                    .recipient(recipient)
                    .triggerUser(trigger)
                    .type(request.getType())
                    .title(request.getTitle())
                    .message(request.getMessage())
                    .entityType(request.getEntityType())
                    .entityId(request.getEntityId())
                    .actionUrl(request.getActionUrl())
                    .metadata(copyOf(request.getMetadata()))
                    .createdAt(now)
                    .expiresAt(request.getExpiresAt())
                    .build());
        }
        List<Notification> saved = notificationRepository.saveAll(batch);
        log.info("Bulk notification type={} delivered={} requested={}",
                request.getType(), saved.size(), recipientIds.size());
        return saved.stream().map(NotificationResponse::from).toList();
    }

    // ============================== READ ==============================

    @Override
    @Transactional(readOnly = true)
    public NotificationResponse get(User user, UUID id) {
        return NotificationResponse.from(owned(user, id));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<NotificationResponse> list(User user, NotificationQuery query) {
        NotificationQuery q = query != null ? query : new NotificationQuery();
        return notificationRepository.search(user, q.getType(), q.getStatus(), q.isIncludeExpired(),
                        clock.instant(), toPageable(q))
                .map(NotificationResponse::from);
    }

    @Override
    @Transactional(readOnly = true)
    public NotificationStats stats(User user) {
        Map<NotificationType, Long> byType = new EnumMap<>(NotificationType.class);
        for (NotificationType t : NotificationType.values()) {
            byType.put(t, 0L);
        }
        long unread = 0;
        long read = 0;
        long archived = 0;
        for (StatusTypeCount row : notificationRepository.countByStatusAndType(user, clock.instant())) {
            byType.merge(row.getType(), row.getTotal(), Long::sum);
            switch (row.getStatus()) {
                case UNREAD -> unread += row.getTotal();
                case READ -> read += row.getTotal();
                case ARCHIVED -> archived += row.getTotal();
            }
        }
        return NotificationStats.builder()
                .total(unread + read + archived)
                .unread(unread)
                .read(read)
                .archived(archived)
                .byType(byType)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<NotificationResponse> unread(User user, int limit) {
        int size = limit <= 0 ? DEFAULT_PAGE_SIZE : Math.min(limit, MAX_PAGE_SIZE);
        return notificationRepository.findUnread(user, clock.instant(), PageRequest.of(0, size)).stream()
                .map(NotificationResponse::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long unreadCount(User user) {
        return notificationRepository.countUnread(user, clock.instant());
    }

    // ============================== STATE ==============================

    @Override
    @Transactional
    public NotificationResponse markAsRead(User user, UUID id) {
        Notification n = owned(user, id);
        n.markAsRead(clock.instant());
        return NotificationResponse.from(n);
    }

    @Override
    @Transactional
    public NotificationResponse markAsUnread(User user, UUID id) {
        Notification n = owned(user, id);
        n.markAsUnread();
        return NotificationResponse.from(n);
    }

    @Override
    @Transactional
    public NotificationResponse archive(User user, UUID id) {
        Notification n = owned(user, id);
        n.archive(clock.instant());
        return NotificationResponse.from(n);
    }

    @Override
    @Transactional
    public NotificationResponse unarchive(User user, UUID id) {
        Notification n = owned(user, id);
        n.unarchive();
        return NotificationResponse.from(n);
    }

    @Override
    @Transactional
    public int markAllAsRead(User user, NotificationType type, Instant olderThan) {
        Instant now = clock.instant();
        List<Notification> targets = notificationRepository.findForBulkUpdate(
                user, List.of(NotificationStatus.UNREAD), type, olderThan);
        targets.forEach(n -> n.markAsRead(now));
        return targets.size();
    }

    @Override
    @Transactional
    public int archiveAll(User user, NotificationType type, Instant olderThan) {
        Instant now = clock.instant();
        List<Notification> targets = notificationRepository.findForBulkUpdate(
                user, List.of(NotificationStatus.UNREAD, NotificationStatus.READ), type, olderThan);
        targets.forEach(n -> n.archive(now));
        return targets.size();
    }

    @Override
    @Transactional
    public void delete(User user, UUID id) {
        notificationRepository.delete(owned(user, id));
    }

    // ============================== EVENTS ==============================

    @Override
    @Transactional
    public Optional<NotificationResponse> notifyLike(UUID recipientId, UUID postId, UUID triggerUserId) {
        return notifyEvent(recipientId, triggerUserId, NotificationType.LIKE, "New Like",
                "liked your post", "Post", postId, "/posts/" + postId, Map.of());
    }

    @Override
    @Transactional
    public Optional<NotificationResponse> notifyComment(UUID recipientId, UUID postId, UUID commentId,
                                                        UUID triggerUserId) {
        return notifyEvent(recipientId, triggerUserId, NotificationType.COMMENT, "New Comment",
                "commented on your post", "Comment", commentId,
                "/posts/" + postId + "#comment-" + commentId, Map.of("postId", String.valueOf(postId)));
    }

    @Override
    @Transactional
    public Optional<NotificationResponse> notifyFollow(UUID recipientId, UUID triggerUserId) {
        return notifyEvent(recipientId, triggerUserId, NotificationType.FOLLOW, "New Follower",
                "started following you", "User", triggerUserId, "/users/" + triggerUserId, Map.of());
    }

    @Override
    @Transactional
    public Optional<NotificationResponse> notifyMention(UUID recipientId, UUID postId, UUID triggerUserId) {
        return notifyEvent(recipientId, triggerUserId, NotificationType.MENTION, "You were mentioned",
                "mentioned you in a post", "Post", postId, "/posts/" + postId, Map.of());
    }

    // ============================== HOUSEKEEPING ==============================

    @Override
    @Transactional
    public int cleanupExpired(Instant now) {
        List<Notification> expired = notificationRepository.findAllByExpiresAtBefore(now);
        notificationRepository.deleteAll(expired);
        return expired.size();
    }

    @Override
    @Transactional
    public int cleanupArchivedOlderThan(int days, Instant now) {
        Instant cutoff = now.minus(days, ChronoUnit.DAYS);
        List<Notification> stale = notificationRepository.findAllByStatusAndArchivedAtBefore(
                NotificationStatus.ARCHIVED, cutoff);
        notificationRepository.deleteAll(stale);
        return stale.size();
    }

    // =========================== INTERNALS ===========================

    private Optional<NotificationResponse> notifyEvent(UUID recipientId, UUID triggerUserId, NotificationType type,
                                                       String title, String action, String entityType,
                                                       UUID entityId, String actionUrl,
                                                       Map<String, String> metadata) {
        if (Objects.equals(recipientId, triggerUserId)) {
            return Optional.empty();
        }
        User recipient = findUser(recipientId);
        User trigger = triggerUserId != null ? userRepository.findById(triggerUserId).orElse(null) : null;
        String name = trigger != null ? trigger.getDisplayName() : FALLBACK_NAME;

        Notification saved = notificationRepository.save(Notification.builder()
                .recipient(recipient)
                .triggerUser(trigger)
                .type(type)
                .title(title)
                .message(name + " " + action)
                .entityType(entityType)
                .entityId(entityId)
                .actionUrl(actionUrl)
                .metadata(new HashMap<>(metadata))
                .createdAt(clock.instant())
                .build());
        return Optional.of(NotificationResponse.from(saved));
    }

    private Notification owned(User user, UUID id) {
        return notificationRepository.findByIdAndRecipient(id, user)
                .orElseThrow(() -> new ResourceExceptions.NotificationNotFound(id));
    }

    private User findUser(UUID id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new UserExceptions.UserNotFound("User '" + id + "' was not found."));
    }

    private static void requireFutureExpiry(Instant expiresAt, Instant now) {
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            throw new RequestExceptions.InvalidParameter("expiresAt must be in the future.");
        }
    }

    private static Pageable toPageable(NotificationQuery q) {
        String sortBy = q.getSortBy() == null ? "createdAt" : q.getSortBy();
        if (!SORTABLE_FIELDS.contains(sortBy)) {
            throw new RequestExceptions.InvalidParameter(
                    "sortBy must be one of " + String.join(", ", new TreeSet<>(SORTABLE_FIELDS)) + ".");
        }
        Sort.Direction direction = Sort.Direction.fromOptionalString(q.getSortDirection())
                .orElse(Sort.Direction.DESC);
        int page = Math.max(0, q.getPage());
        int size = q.getSize() <= 0 ? DEFAULT_PAGE_SIZE : Math.min(q.getSize(), MAX_PAGE_SIZE);
        return PageRequest.of(page, size, Sort.by(direction, sortBy));
    }

    private static Map<String, String> copyOf(Map<String, String> metadata) {
        return metadata == null ? new HashMap<>() : new HashMap<>(metadata);
    }
}
