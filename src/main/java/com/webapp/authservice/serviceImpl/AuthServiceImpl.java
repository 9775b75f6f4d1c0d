package com.webapp.authservice.serviceImpl;

import com.webapp.authservice.SecurityConfig.JwtTokenProviderConfig;
import com.webapp.authservice.SecurityConfig.JwtTokenProviderConfig.IssuedAccessToken;
import com.webapp.authservice.SecurityConfig.TokenBlacklistConfig;
import com.webapp.authservice.dto.*;
import com.webapp.authservice.entity.Profile;
import com.webapp.authservice.entity.RefreshToken;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.entity.UserRole;
import com.webapp.authservice.entity.UserSession;
import com.webapp.authservice.exception.AuthExceptions;
import com.webapp.authservice.exception.UserExceptions;
import com.webapp.authservice.repository.UserRepository;
import com.webapp.authservice.service.AuthService;
import com.webapp.authservice.service.EmailService;
import com.webapp.authservice.service.PasswordResetService;
import com.webapp.authservice.service.PasswordService;
import com.webapp.authservice.service.RefreshTokenService;
import com.webapp.authservice.service.RefreshTokenService.RotatedRefreshToken;
import com.webapp.authservice.service.UserSessionService;
import com.webapp.authservice.utils.TokenHashing;
import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private final UserRepository userRepository;
    private final PasswordService passwordService;
    private final JwtTokenProviderConfig jwtService;
    private final TokenBlacklistConfig tokenBlacklist;
    private final RefreshTokenService refreshTokenService;
    private final UserSessionService userSessionService;
    private final PasswordResetService passwordResetService;
    private final EmailService emailService;
    private final UserServiceImpl userDetailsCache;
    private final Clock clock;

    @Value("${auth.lockout.max-failed-attempts:5}")
    private int maxFailedAttempts = 5;

    @Value("${auth.lockout.duration:PT30M}")
    private Duration lockoutDuration = Duration.ofMinutes(30);

    @Value("${session.default-lifetime:P1D}")
    private Duration defaultSessionLifetime = Duration.ofDays(1);

    @Value("${session.remember-me-lifetime:P30D}")
    private Duration rememberMeSessionLifetime = Duration.ofDays(30);

    @Value("${session.registration-lifetime:P7D}")
    private Duration registrationSessionLifetime = Duration.ofDays(7);

    @Value("${app.frontend-url:http://localhost:3000}")
    private String frontendUrl = "http://localhost:3000";

    // ============================== REGISTER / LOGIN ==============================

    @Override
    @Transactional
    public AuthResponse register(RegistrationRequest request, ClientContext client) {
        final String email = normalize(request.getEmail());
        final String username = normalize(request.getUsername());

        if (userRepository.existsByEmail(email)) {
            throw new UserExceptions.UserAlreadyExists(email);
        }
        if (userRepository.existsByUsername(username)) {
            throw new UserExceptions.UsernameTaken(username);
        }

        String confirmationToken = UUID.randomUUID().toString();
        User user = User.builder()
                .email(email)
                .username(username)
                .password(passwordService.hash(request.getPassword()))
                .role(UserRole.ROLE_USER)
                .enabled(true)
                .emailConfirmed(false)
                .emailConfirmationTokenHash(TokenHashing.sha256Hex(confirmationToken))
                .build();

        Profile profile = Profile.builder()
                .user(user)
                .displayName(StringUtils.hasText(request.getDisplayName())
                        ? request.getDisplayName().trim() : username)
                .firstName(trimToNull(request.getFirstName()))
                .lastName(trimToNull(request.getLastName()))
                .build();
        user.setProfile(profile);

        User saved = userRepository.save(user);
        log.info("Registered user id={} username={}", saved.getId(), saved.getHandle());

        emailService.sendEmailConfirmation(saved, confirmationToken);
        emailService.sendWelcome(saved);

        UserSession session = userSessionService.create(saved, registrationSessionLifetime, client);
        return issueTokens(saved, session, client);
    }

    /**
     * Failed attempts must be persisted even though the call fails, hence no rollback for
     * {@link AuthExceptions.InvalidCredentials}.
     */
    @Override
    @Transactional(noRollbackFor = AuthExceptions.InvalidCredentials.class)
    public AuthResponse login(LoginRequest request, ClientContext client) {
        final String identifier = normalize(request.getIdentifier());
        final Instant now = clock.instant();

        Optional<User> found = identifier.contains("@")
                ? userRepository.findByEmail(identifier)
                : userRepository.findByUsername(identifier);
        User user = found.filter(u -> !u.isDeleted())
                .orElseThrow(AuthExceptions.InvalidCredentials::new);

        if (user.isLockedOut(now)) {
            log.warn("Login attempt on locked account user={}", user.getId());
            throw new AuthExceptions.AccountLocked(
                    "Account is locked due to too many failed attempts. Try again after " + user.getLockoutEndAt() + ".");
        }

        if (!passwordService.verify(request.getPassword(), user.getPassword())) {
            boolean lockedNow = user.recordFailedLogin(now, maxFailedAttempts, lockoutDuration);
            userRepository.save(user);
            if (lockedNow) {
                log.warn("Account locked after repeated failures user={} until={}", user.getId(), user.getLockoutEndAt());
                userDetailsCache.evictUserDetails(user.getEmail());
                emailService.sendSecurityAlert(user, "Account locked after repeated failed sign-ins",
                        client != null ? client.getIpAddress() : null);
            } else {
                log.warn("Failed login for user={} attempts={}", user.getId(), user.getFailedLoginAttempts());
            }
            throw new AuthExceptions.InvalidCredentials();
        }

        if (!user.isEnabled()) {
            throw new AuthExceptions.AccountDisabled();
        }
        if (!user.isEmailConfirmed()) {
            throw new AuthExceptions.EmailNotConfirmed();
        }

        user.recordSuccessfulLogin(now);
        userRepository.save(user);

        ClientContext ctx = client != null ? client : ClientContext.unknown();
        if (StringUtils.hasText(request.getLocation())) {
            ctx = ctx.toBuilder().location(request.getLocation().trim()).build();
        }
        Duration lifetime = request.isRememberMe() ? rememberMeSessionLifetime : defaultSessionLifetime;
        UserSession session = userSessionService.create(user, lifetime, ctx);

        log.info("Login success user={} session={}", user.getId(), session.getSessionId());
        return issueTokens(user, session, ctx);
    }

    // ============================== TOKENS ==============================

    @Override
    @Transactional(noRollbackFor = AuthExceptions.InvalidRefreshToken.class)
    public AuthResponse refresh(String refreshToken, ClientContext client) {
        RotatedRefreshToken rotated = refreshTokenService.rotate(refreshToken, client);
        User user = rotated.user();
        String sessionId = rotated.token().sessionId();

        if (!user.isEnabled() || user.isLockedOut(clock.instant())) {
            refreshTokenService.revokeAllForSession(sessionId, ip(client), "Account not active");
            userSessionService.terminate(sessionId);
            throw new AuthExceptions.InvalidRefreshToken("Account is not active.");
        }

        userSessionService.touch(sessionId);
        IssuedAccessToken access = jwtService.generateAccessToken(user, sessionId);
        refreshTokenService.bindAccessToken(rotated.token().raw(), access.jwtId());

        log.debug("Refreshed tokens for user={} session={}", user.getId(), sessionId);
        return buildResponse(user, access, rotated.token());
    }

    @Override
    @Transactional(readOnly = true)
    public TokenValidationResponse validateToken(String accessToken) {
        Optional<Claims> parsed = jwtService.validate(accessToken);
        if (parsed.isEmpty()) {
            return TokenValidationResponse.invalid();
        }
        Claims claims = parsed.get();
        if (tokenBlacklist.isBlacklisted(claims.getId())) {
            return TokenValidationResponse.invalid();
        }
        String sessionId = claims.get(JwtTokenProviderConfig.CLAIM_SESSION_ID, String.class);
        if (userSessionService.findValid(sessionId).isEmpty()) {
            return TokenValidationResponse.invalid();
        }
        return TokenValidationResponse.builder()
                .valid(true)
                .userId(claims.getSubject())
                .username(claims.get(JwtTokenProviderConfig.CLAIM_USERNAME, String.class))
                .email(claims.get(JwtTokenProviderConfig.CLAIM_EMAIL, String.class))
                .sessionId(sessionId)
                .expiresAt(claims.getExpiration().toInstant())
                .build();
    }

    // ============================== LOGOUT ==============================

    @Override
    @Transactional
    public void logout(User user, String refreshToken, String accessToken, ClientContext client) {
        String sessionId = null;

        if (StringUtils.hasText(refreshToken)) {
            Optional<RefreshToken> token = refreshTokenService.findActive(refreshToken)
                    .filter(t -> Objects.equals(t.getUser().getId(), user.getId()));
            if (token.isPresent()) {
                sessionId = token.get().getSessionId();
                refreshTokenService.revoke(user, refreshToken, ip(client), "Logged out");
            }
        }
        if (sessionId == null && StringUtils.hasText(accessToken)) {
            sessionId = jwtService.validate(accessToken)
                    .map(c -> c.get(JwtTokenProviderConfig.CLAIM_SESSION_ID, String.class))
                    .orElse(null);
        }

        if (sessionId != null && ownsSession(user, sessionId)) {
            refreshTokenService.revokeAllForSession(sessionId, ip(client), "Logged out");
            userSessionService.terminate(sessionId);
        }
        if (StringUtils.hasText(accessToken)) {
            tokenBlacklist.addToBlacklist(accessToken);
        }
        log.info("Logout user={} session={}", user.getId(), sessionId);
    }

    @Override
    @Transactional
    public void logoutAll(User user, String accessToken, ClientContext client) {
        int revoked = refreshTokenService.revokeAllForUser(user, ip(client), "Logged out of all sessions");
        int ended = userSessionService.terminateAllForUser(user);
        if (StringUtils.hasText(accessToken)) {
            tokenBlacklist.addToBlacklist(accessToken);
        }
        log.info("Logout-all user={} revokedTokens={} endedSessions={}", user.getId(), revoked, ended);
    }

    // ============================== PASSWORD ==============================

    @Override
    @Transactional
    public void changePassword(User principal, ChangePasswordRequest request, ClientContext client) {
        User user = reload(principal);

        if (!passwordService.verify(request.getCurrentPassword(), user.getPassword())) {
            log.warn("Password change rejected: wrong current password user={}", user.getId());
            throw new AuthExceptions.InvalidCredentials();
        }
        if (passwordService.verify(request.getNewPassword(), user.getPassword())) {
            throw new UserExceptions.InvalidUserInput("New password must be different from the current password.");
        }

        user.changePassword(passwordService.hash(request.getNewPassword()), clock.instant());
        userRepository.save(user);

        endEverySession(user, client, "Password changed");
        emailService.sendPasswordChanged(user);
        log.info("Password changed user={}", user.getId());
    }

    @Override
    @Transactional
    public void forgotPassword(String email) {
        final String normalized = normalize(email);
        Optional<User> found = userRepository.findByEmail(normalized).filter(User::isEnabled);
        if (found.isEmpty()) {
            log.debug("Password reset requested for unknown or inactive account");
            return;
        }
        User user = found.get();
        String raw = passwordResetService.issue(user);
        String link = frontendUrl + "/reset-password?token=" + urlEncode(raw) + "&email=" + urlEncode(normalized);
        emailService.sendPasswordReset(user, link);
        log.info("Password reset issued user={}", user.getId());
    }

    @Override
    @Transactional
    public void resetPassword(ResetPasswordRequest request, ClientContext client) {
        User user = passwordResetService.consume(request.getEmail(), request.getToken());

        user.changePassword(passwordService.hash(request.getNewPassword()), clock.instant());
        user.clearLockout();
        userRepository.save(user);

        endEverySession(user, client, "Password reset");
        emailService.sendPasswordChanged(user);
        log.info("Password reset completed user={}", user.getId());
    }

    // ============================== EMAIL CONFIRMATION ==============================

    @Override
    @Transactional
    public void confirmEmail(String email, String token) {
        User user = userRepository.findByEmail(normalize(email))
                .orElseThrow(AuthExceptions.InvalidConfirmationToken::new);
        if (user.isEmailConfirmed()) {
            return;
        }
        String stored = user.getEmailConfirmationTokenHash();
        if (stored == null || !StringUtils.hasText(token) || !stored.equals(TokenHashing.sha256Hex(token.trim()))) {
            throw new AuthExceptions.InvalidConfirmationToken();
        }
        user.confirmEmail();
        userRepository.save(user);
        userDetailsCache.evictUserDetails(user.getEmail());
        log.info("Email confirmed user={}", user.getId());
    }

    @Override
    @Transactional
    public void resendEmailConfirmation(String email) {
        Optional<User> found = userRepository.findByEmail(normalize(email))
                .filter(u -> !u.isEmailConfirmed());
        if (found.isEmpty()) {
            return;
        }
        User user = found.get();
        String confirmationToken = UUID.randomUUID().toString();
        user.setEmailConfirmationTokenHash(TokenHashing.sha256Hex(confirmationToken));
        userRepository.save(user);
        emailService.sendEmailConfirmation(user, confirmationToken);
    }

    // ============================== SESSIONS / PROFILE ==============================

    @Override
    @Transactional(readOnly = true)
    public List<SessionSummary> getActiveSessions(User user, String currentSessionId) {
        return userSessionService.listActive(user).stream()
                .map(s -> SessionSummary.builder()
                        .sessionId(s.getSessionId())
                        .ipAddress(s.getIpAddress())
                        .userAgent(s.getUserAgent())
                        .deviceInfo(s.getDeviceInfo())
                        .location(s.getLocation())
                        .createdAt(s.getCreatedAt())
                        .lastActivityAt(s.getLastActivityAt())
                        .expiresAt(s.getExpiresAt())
                        .current(s.getSessionId().equals(currentSessionId))
                        .build())
                .toList();
    }

    @Override
    @Transactional
    public void revokeSession(User user, String sessionId, ClientContext client) {
        if (!ownsSession(user, sessionId)) {
            throw new AuthExceptions.SessionNotFound(sessionId);
        }
        userSessionService.terminate(sessionId);
        int revoked = refreshTokenService.revokeAllForSession(sessionId, ip(client), "Session revoked");
        log.info("Session {} revoked by user={} tokens={}", sessionId, user.getId(), revoked);
    }

    @Override
    @Transactional(readOnly = true)
    public UserSummary getCurrentUser(User principal) {
        return toSummary(reload(principal));
    }

    // =========================== INTERNALS ===========================

    private AuthResponse issueTokens(User user, UserSession session, ClientContext client) {
        IssuedAccessToken access = jwtService.generateAccessToken(user, session.getSessionId());
        IssuedRefreshToken refresh = refreshTokenService.issue(user, session.getSessionId(), access.jwtId(), client);
        return buildResponse(user, access, refresh);
    }

    private AuthResponse buildResponse(User user, IssuedAccessToken access, IssuedRefreshToken refresh) {
        return AuthResponse.builder()
                .accessToken(access.token())
                .expiresIn(jwtService.getTokenValiditySeconds())
                .accessTokenExpiresAt(access.expiresAt())
                .refreshToken(refresh.raw())
                .refreshTokenExpiresAt(refresh.expiresAt())
                .sessionId(refresh.sessionId())
                .issuedAt(clock.instant())
                .user(toSummary(user))
                .build();
    }

    private void endEverySession(User user, ClientContext client, String reason) {
        refreshTokenService.revokeAllForUser(user, ip(client), reason);
        userSessionService.terminateAllForUser(user);
        userDetailsCache.evictUserDetails(user.getEmail());
    }

    private boolean ownsSession(User user, String sessionId) {
        return userSessionService.findBySessionId(sessionId)
                .map(s -> Objects.equals(s.getUser().getId(), user.getId()))
                .orElse(false);
    }

    /** The authenticated principal may be a cached, detached copy. */
    private User reload(User principal) {
        return userRepository.findById(principal.getId())
                .orElseThrow(() -> new UserExceptions.UserNotFound("User not found."));
    }

    private static UserSummary toSummary(User user) {
        Profile profile = user.getProfile();
        return UserSummary.builder()
                .id(String.valueOf(user.getId()))
                .email(user.getEmail())
                .username(user.getHandle())
                .displayName(user.getDisplayName())
                .firstName(profile != null ? profile.getFirstName() : null)
                .lastName(profile != null ? profile.getLastName() : null)
                .profileImageUrl(profile != null ? profile.getProfileImageUrl() : null)
                .roles(Set.of(user.getRole().name()))
                .emailConfirmed(user.isEmailConfirmed())
                .lastLoginAt(user.getLastLoginAt())
                .createdAt(user.getCreatedAt())
                .build();
    }

    private static String ip(ClientContext client) {
        return client != null ? client.getIpAddress() : null;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
