package com.webapp.authservice.repository;

import com.webapp.authservice.entity.RefreshToken;
import com.webapp.authservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    /** Active tokens of a user: unused, unrevoked, unexpired. */
    List<RefreshToken> findAllByUserAndUsedFalseAndRevokedFalseAndExpiresAtAfter(User user, Instant now);

    List<RefreshToken> findAllBySessionIdAndUsedFalseAndRevokedFalseAndExpiresAtAfter(String sessionId, Instant now);

    long countByUser(User user);

    long countByUserAndUsedFalseAndRevokedFalseAndExpiresAtAfter(User user, Instant now);

    long countByUserAndExpiresAtLessThanEqual(User user, Instant now);

    long countByUserAndRevokedTrue(User user);

    /** Hard delete for the housekeeping sweep. */
    @Modifying
    @Query("""
            delete from RefreshToken rt
             where rt.expiresAt <= :now
                or ((rt.revoked = true or rt.used = true) and rt.issuedAt < :retainAfter)
            """)
    int deleteExpiredOrRetired(@Param("now") Instant now, @Param("retainAfter") Instant retainAfter);
}
