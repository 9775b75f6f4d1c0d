package com.webapp.authservice.repository;

import com.webapp.authservice.entity.Notification;
import com.webapp.authservice.entity.NotificationStatus;
import com.webapp.authservice.entity.NotificationType;
import com.webapp.authservice.entity.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Optional<Notification> findByIdAndRecipient(UUID id, User recipient);

    @Query("""
            select n
              from Notification n
             where n.recipient = :recipient
               and (:type is null or n.type = :type)
               and (:status is null or n.status = :status)
               and (:includeExpired = true or n.expiresAt is null or n.expiresAt >= :now)
            """)
    Page<Notification> search(@Param("recipient") User recipient,
                              @Param("type") NotificationType type,
                              @Param("status") NotificationStatus status,
                              @Param("includeExpired") boolean includeExpired,
                              @Param("now") Instant now,
                              Pageable pageable);

    @Query("""
            select n
              from Notification n
             where n.recipient = :recipient
               and n.status = com.webapp.authservice.entity.NotificationStatus.UNREAD
               and (n.expiresAt is null or n.expiresAt >= :now)
             order by n.createdAt desc
            """)
    List<Notification> findUnread(@Param("recipient") User recipient, @Param("now") Instant now, Pageable pageable);

    @Query("""
            select count(n)
              from Notification n
             where n.recipient = :recipient
               and n.status = com.webapp.authservice.entity.NotificationStatus.UNREAD
               and (n.expiresAt is null or n.expiresAt >= :now)
            """)
    long countUnread(@Param("recipient") User recipient, @Param("now") Instant now);

    @Query("""
            select n.status as status, n.type as type, count(n) as total
              from Notification n
             where n.recipient = :recipient
               and (n.expiresAt is null or n.expiresAt >= :now)
             group by n.status, n.type
            """)
    List<StatusTypeCount> countByStatusAndType(@Param("recipient") User recipient, @Param("now") Instant now);

    /** Candidates for a bulk read/archive, limited to the statuses the bulk operation moves away from. */
    @Query("""
            select n
              from Notification n
             where n.recipient = :recipient
               and n.status in :statuses
               and (:type is null or n.type = :type)
               and (:olderThan is null or n.createdAt <= :olderThan)
            """)
    List<Notification> findForBulkUpdate(@Param("recipient") User recipient,
                                         @Param("statuses") List<NotificationStatus> statuses,
                                         @Param("type") NotificationType type,
                                         @Param("olderThan") Instant olderThan);

    List<Notification> findAllByExpiresAtBefore(Instant now);

    List<Notification> findAllByStatusAndArchivedAtBefore(NotificationStatus status, Instant cutoff);

    interface StatusTypeCount {
        NotificationStatus getStatus();

        NotificationType getType();

        long getTotal();
    }
}
