package com.webapp.authservice.repository;

import com.webapp.authservice.entity.User;
import com.webapp.authservice.entity.UserSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface UserSessionRepository extends JpaRepository<UserSession, Long> {

    Optional<UserSession> findBySessionId(String sessionId);

    List<UserSession> findAllByUserAndActiveTrueAndExpiresAtAfterOrderByLastActivityAtDesc(User user, Instant now);

    List<UserSession> findAllByUserAndActiveTrue(User user);

    @Modifying
    @Query("""
            delete from UserSession us
             where us.expiresAt <= :now
                or (us.active = false and us.endedAt < :retainAfter)
            """)
    int deleteExpiredOrEnded(@Param("now") Instant now, @Param("retainAfter") Instant retainAfter);
}
