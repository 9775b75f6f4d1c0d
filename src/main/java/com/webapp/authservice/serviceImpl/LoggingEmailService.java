package com.webapp.authservice.serviceImpl;

import com.webapp.authservice.entity.User;
import com.webapp.authservice.service.EmailService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Records outbound account mail in the log instead of delivering it.
 * Tokens and links are never written out; only the recipient and the message kind.
 */
@Slf4j
@Service
public class LoggingEmailService implements EmailService {

    @Override
    public void sendEmailConfirmation(User user, String confirmationToken) {
        log.info("[mail] kind=email-confirmation to={} tokenIssued={}", user.getEmail(), confirmationToken != null);
    }

    @Override
    public void sendWelcome(User user) {
        log.info("[mail] kind=welcome to={} name={}", user.getEmail(), user.getDisplayName());
    }

    @Override
    public void sendPasswordReset(User user, String resetLink) {
        log.info("[mail] kind=password-reset to={} linkIssued={}", user.getEmail(), resetLink != null);
    }

    @Override
    public void sendPasswordChanged(User user) {
        log.info("[mail] kind=password-changed to={}", user.getEmail());
    }

    @Override
    public void sendSecurityAlert(User user, String event, String ipAddress) {
        log.info("[mail] kind=security-alert to={} event={} ip={}", user.getEmail(), event, ipAddress);
    }
}
