package com.webapp.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Authentication and credential-lifecycle failures.
 * Details stay generic where a specific message would reveal whether an account exists.
 */
public final class AuthExceptions {

    private AuthExceptions() {}

    /** 401 – Unknown identifier or wrong password. */
    public static final class InvalidCredentials extends ApiException {
        public InvalidCredentials() {
            super(HttpStatus.UNAUTHORIZED, "invalid-credentials", "Invalid Credentials",
                    "Invalid email/username or password.");
        }
    }

    /** 423 – Too many failed attempts; the lockout window has not elapsed. */
    public static final class AccountLocked extends ApiException {
        public AccountLocked(String detail) {
            super(HttpStatus.LOCKED, "account-locked", "Account Locked", detail);
        }
    }

    /** 403 – Account disabled by an administrator. */
    public static final class AccountDisabled extends ApiException {
        public AccountDisabled() {
            super(HttpStatus.FORBIDDEN, "account-disabled", "Account Disabled", "This account has been disabled.");
        }
    }

    /** 403 – Login attempted before the email address was confirmed. */
    public static final class EmailNotConfirmed extends ApiException {
        public EmailNotConfirmed() {
            super(HttpStatus.FORBIDDEN, "email-not-confirmed", "Email Not Confirmed",
                    "Please confirm your email address before signing in.");
        }
    }

    /** 401 – Refresh token unknown, expired, reused or bound to an ended session. */
    public static final class InvalidRefreshToken extends ApiException {
        public InvalidRefreshToken(String detail) {
            super(HttpStatus.UNAUTHORIZED, "invalid-refresh-token", "Invalid Refresh Token", detail);
        }
    }

    /** 400 – Password reset token does not match, was used, or expired. */
    public static final class InvalidResetToken extends ApiException {
        public InvalidResetToken() {
            super(HttpStatus.BAD_REQUEST, "invalid-reset-token", "Invalid Reset Token",
                    "Invalid or expired reset token.");
        }
    }

    /** 400 – Email confirmation token does not match. */
    public static final class InvalidConfirmationToken extends ApiException {
        public InvalidConfirmationToken() {
            super(HttpStatus.BAD_REQUEST, "invalid-confirmation-token", "Invalid Confirmation Token",
                    "Invalid email confirmation token.");
        }
    }

    /** 404 – Session does not exist or belongs to another user. */
    public static final class SessionNotFound extends ApiException {
        public SessionNotFound(String sessionId) {
            super(HttpStatus.NOT_FOUND, "session-not-found", "Session Not Found",
                    "Session '" + sessionId + "' was not found.");
        }
    }
}
