package com.webapp.authservice.repository;

import com.webapp.authservice.entity.PasswordResetToken;
import com.webapp.authservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface PasswordResetTokenRepository extends JpaRepository<PasswordResetToken, Long> {

    Optional<PasswordResetToken> findByTokenHash(String tokenHash);

    @Modifying
    @Query("""
            update PasswordResetToken prt
               set prt.used = true,
                   prt.usedAt = :now
             where prt.user = :user
               and prt.used = false
            """)
    int invalidateAllForUser(@Param("user") User user, @Param("now") Instant now);

    @Modifying
    @Query("delete from PasswordResetToken prt where prt.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
