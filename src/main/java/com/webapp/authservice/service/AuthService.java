package com.webapp.authservice.service;

import com.webapp.authservice.dto.*;
import com.webapp.authservice.entity.User;

import java.util.List;

public interface AuthService {

    AuthResponse register(RegistrationRequest request, ClientContext client);

    AuthResponse login(LoginRequest request, ClientContext client);

    AuthResponse refresh(String refreshToken, ClientContext client);

    /**
     * Ends one session: the refresh token's session when given, otherwise the access token's.
     */
    void logout(User user, String refreshToken, String accessToken, ClientContext client);

    void logoutAll(User user, String accessToken, ClientContext client);

    void changePassword(User user, ChangePasswordRequest request, ClientContext client);

    /** Silent for unknown emails. */
    void forgotPassword(String email);

    void resetPassword(ResetPasswordRequest request, ClientContext client);

    TokenValidationResponse validateToken(String accessToken);

    void confirmEmail(String email, String token);

    void resendEmailConfirmation(String email);

    List<SessionSummary> getActiveSessions(User user, String currentSessionId);

    void revokeSession(User user, String sessionId, ClientContext client);

    UserSummary getCurrentUser(User user);
}
