package com.webapp.authservice.service;

import com.webapp.authservice.entity.User;

/**
 * Outbound account mail. Implementations must not throw back into the auth flow.
 */
public interface EmailService {

    void sendEmailConfirmation(User user, String confirmationToken);

    void sendWelcome(User user);

    void sendPasswordReset(User user, String resetLink);

    void sendPasswordChanged(User user);

    void sendSecurityAlert(User user, String event, String ipAddress);
}
