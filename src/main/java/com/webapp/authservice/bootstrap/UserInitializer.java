package com.webapp.authservice.bootstrap;

import com.webapp.authservice.entity.Profile;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.entity.UserRole;
import com.webapp.authservice.repository.UserRepository;
import com.webapp.authservice.service.PasswordService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Seeds one confirmed admin and one confirmed regular account for local environments.
 * Off unless {@code app.init.enabled=true}.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.init.enabled", havingValue = "true")
public class UserInitializer implements CommandLineRunner {

    private final UserRepository userRepository;
    private final PasswordService passwordService;

    @Value("${app.init.admin.email:admin@example.com}")
    private String adminEmail;

    @Value("${app.init.admin.password}")
    private String adminPlainPassword;

    @Value("${app.init.user.email:user@example.com}")
    private String userEmail;

    @Value("${app.init.user.password}")
    private String userPlainPassword;

    @Override
    @Transactional
    public void run(String... args) {
        createUserIfNotExists(adminEmail, "admin", ensureEncoded(adminPlainPassword), UserRole.ROLE_ADMIN,
                "Administrator", "Super", "Admin");
        createUserIfNotExists(userEmail, "demo_user", ensureEncoded(userPlainPassword), UserRole.ROLE_USER,
                "Demo User", "Test", "User");
    }

    private void createUserIfNotExists(String email,
                                       String username,
                                       String passwordHash,
                                       UserRole role,
                                       String displayName,
                                       String firstName,
                                       String lastName) {
        if (userRepository.existsByEmail(email) || userRepository.existsByUsername(username)) {
            log.info("Seed account '{}' already present", email);
            return;
        }
        User user = User.builder()
                .email(email)
                .username(username)
                .password(passwordHash)
                .role(role)
                .enabled(true)
                .emailConfirmed(true)
                .build();

        Profile profile = Profile.builder()
                .user(user)
                .displayName(displayName)
                .firstName(firstName)
                .lastName(lastName)
                .build();

        user.setProfile(profile);
        userRepository.save(user);
        log.info("{} '{}' with profile added successfully.", role, email);
    }

    private String ensureEncoded(String rawOrEncoded) {
        if (rawOrEncoded == null) throw new IllegalArgumentException("Password cannot be null");
        if (isBcrypt(rawOrEncoded)) return rawOrEncoded;
        return passwordService.hash(rawOrEncoded);
    }

    private boolean isBcrypt(String value) {
        return value.startsWith("$2a$") || value.startsWith("$2b$") || value.startsWith("$2y$");
    }
}
