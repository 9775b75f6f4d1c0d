package com.webapp.authservice.serviceImpl;

import com.webapp.authservice.entity.PasswordResetToken;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.exception.AuthExceptions;
import com.webapp.authservice.repository.PasswordResetTokenRepository;
import com.webapp.authservice.service.PasswordResetService;
import com.webapp.authservice.utils.TokenHashing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetServiceImpl implements PasswordResetService {

    private static final int TOKEN_BYTES = 32;

    private final PasswordResetTokenRepository resetTokenRepository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Value("${password-reset.lifetime:PT24H}")
    private Duration lifetime = Duration.ofHours(24);

    @Override
    @Transactional
    public String issue(User user) {
        Instant now = clock.instant();
        int invalidated = resetTokenRepository.invalidateAllForUser(user, now);
        if (invalidated > 0) {
            log.debug("Invalidated {} outstanding reset token(s) for user={}", invalidated, user.getId());
        }

        String raw = TokenHashing.randomToken(random, TOKEN_BYTES);
        resetTokenRepository.save(PasswordResetToken.builder()
                .tokenHash(TokenHashing.sha256Hex(raw))
                .user(user)
                .createdAt(now)
                .expiresAt(now.plus(lifetime))
                .build());
        return raw;
    }

    @Override
    @Transactional
    public User consume(String email, String rawToken) {
        if (email == null || email.isBlank() || rawToken == null || rawToken.isBlank()) {
            throw new AuthExceptions.InvalidResetToken();
        }
        Instant now = clock.instant();
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);

        PasswordResetToken token = resetTokenRepository.findByTokenHash(TokenHashing.sha256Hex(rawToken.trim()))
                .filter(t -> t.getUser().getEmail().equalsIgnoreCase(normalizedEmail))
                .filter(t -> t.isValid(now))
                .orElseThrow(AuthExceptions.InvalidResetToken::new);

        token.markUsed(now);
        return token.getUser();
    }

    @Override
    @Transactional
    public int purgeExpired(Instant now) {
        return resetTokenRepository.deleteExpired(now);
    }
}
