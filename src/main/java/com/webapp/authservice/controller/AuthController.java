package com.webapp.authservice.controller;

import com.webapp.authservice.SecurityConfig.JwtAuthenticationDetails;
import com.webapp.authservice.dto.*;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.service.AuthService;
import com.webapp.authservice.utils.ClientContextResolver;
import com.webapp.authservice.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication")
public class AuthController {

    static final String REFRESH_COOKIE = "refreshToken";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;
    private final Clock clock;

    @Value("${auth.cookie.secure:true}")
    private boolean secureCookie = true;

    @PostMapping("/register")
    @ResponseMessage("Registration successful. Please confirm your email address.")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegistrationRequest request,
                                                 HttpServletRequest http) {
        AuthResponse response = authService.register(request, ClientContextResolver.resolve(http));
        return withRefreshCookie(ResponseEntity.status(HttpStatus.CREATED), response);
    }

    @PostMapping("/login")
    @ResponseMessage("Login successful")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest http) {
        AuthResponse response = authService.login(request, ClientContextResolver.resolve(http));
        return withRefreshCookie(ResponseEntity.ok(), response);
    }

    @PostMapping("/refresh")
    @Operation(summary = "Rotate the refresh token", description = "Reads the refreshToken cookie, or the body when no cookie is sent.")
    public ResponseEntity<AuthResponse> refresh(@CookieValue(name = REFRESH_COOKIE, required = false) String cookieToken,
                                                @RequestBody(required = false) RefreshTokenRequest body,
                                                HttpServletRequest http) {
        String raw = StringUtils.hasText(cookieToken) ? cookieToken : (body != null ? body.getRefreshToken() : null);
        AuthResponse response = authService.refresh(raw, ClientContextResolver.resolve(http));
        return withRefreshCookie(ResponseEntity.ok(), response);
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal User user,
                                       Authentication authentication,
                                       @CookieValue(name = REFRESH_COOKIE, required = false) String cookieToken,
                                       @RequestBody(required = false) LogoutRequest body,
                                       HttpServletRequest http) {
        String raw = StringUtils.hasText(cookieToken) ? cookieToken : (body != null ? body.getRefreshToken() : null);
        authService.logout(user, raw, accessToken(authentication), ClientContextResolver.resolve(http));
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, clearRefreshCookie().toString())
                .build();
    }

    @PostMapping("/logout-all")
    public ResponseEntity<Void> logoutAll(@AuthenticationPrincipal User user,
                                          Authentication authentication,
                                          HttpServletRequest http) {
        authService.logoutAll(user, accessToken(authentication), ClientContextResolver.resolve(http));
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, clearRefreshCookie().toString())
                .build();
    }

    @PostMapping("/change-password")
    public ResponseEntity<Void> changePassword(@AuthenticationPrincipal User user,
                                               @Valid @RequestBody ChangePasswordRequest request,
                                               HttpServletRequest http) {
        authService.changePassword(user, request, ClientContextResolver.resolve(http));
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, clearRefreshCookie().toString())
                .build();
    }

    /** Always 202, whether or not the email is registered. */
    @PostMapping("/forgot-password")
    public ResponseEntity<Void> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        authService.forgotPassword(request.getEmail());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/reset-password")
    public ResponseEntity<Void> resetPassword(@Valid @RequestBody ResetPasswordRequest request,
                                              HttpServletRequest http) {
        authService.resetPassword(request, ClientContextResolver.resolve(http));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/confirm-email")
    public ResponseEntity<Void> confirmEmail(@Valid @RequestBody ConfirmEmailRequest request) {
        authService.confirmEmail(request.getEmail(), request.getToken());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/resend-confirmation")
    public ResponseEntity<Void> resendConfirmation(@Valid @RequestBody ResendConfirmationRequest request) {
        authService.resendEmailConfirmation(request.getEmail());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/validate")
    public TokenValidationResponse validate(@RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String header) {
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return TokenValidationResponse.invalid();
        }
        return authService.validateToken(header.substring(BEARER_PREFIX.length()).trim());
    }

    @GetMapping("/me")
    public UserSummary me(@AuthenticationPrincipal User user) {
        return authService.getCurrentUser(user);
    }

    @GetMapping("/sessions")
    public List<SessionSummary> sessions(@AuthenticationPrincipal User user, Authentication authentication) {
        String current = authentication.getDetails() instanceof JwtAuthenticationDetails d ? d.sessionId() : null;
        return authService.getActiveSessions(user, current);
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> revokeSession(@AuthenticationPrincipal User user,
                                              @PathVariable String sessionId,
                                              HttpServletRequest http) {
        authService.revokeSession(user, sessionId, ClientContextResolver.resolve(http));
        return ResponseEntity.noContent().build();
    }

    // =========================== INTERNALS ===========================

    /** Moves the refresh token from the JSON body into an HttpOnly cookie. */
    private ResponseEntity<AuthResponse> withRefreshCookie(ResponseEntity.BodyBuilder builder, AuthResponse response) {
        long maxAge = 0;
        if (response.getRefreshTokenExpiresAt() != null) {
            maxAge = Math.max(Duration.between(Instant.now(clock), response.getRefreshTokenExpiresAt()).getSeconds(), 0);
        }
        ResponseCookie cookie = ResponseCookie.from(REFRESH_COOKIE, response.getRefreshToken())
                .httpOnly(true)
                .secure(secureCookie)
                .sameSite("Strict")
                .path("/auth")
                .maxAge(Duration.ofSeconds(maxAge))
                .build();
        response.setRefreshToken(null);
        return builder.header(HttpHeaders.SET_COOKIE, cookie.toString()).body(response);
    }

    private ResponseCookie clearRefreshCookie() {
        return ResponseCookie.from(REFRESH_COOKIE, "")
                .httpOnly(true)
                .secure(secureCookie)
                .sameSite("Strict")
                .path("/auth")
                .maxAge(Duration.ZERO)
                .build();
    }

    private static String accessToken(Authentication authentication) {
        if (authentication != null && authentication.getDetails() instanceof JwtAuthenticationDetails d) {
            return d.accessToken();
        }
        return null;
    }
}
