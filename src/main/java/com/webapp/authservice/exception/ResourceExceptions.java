package com.webapp.authservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Resource-level failures for owner-scoped records.
 */
public final class ResourceExceptions {

    private ResourceExceptions() {}

    /** 404 Not Found – Notification missing or owned by another user. */
    public static final class NotificationNotFound extends ApiException {
        public NotificationNotFound(UUID id) {
            super(HttpStatus.NOT_FOUND, "notification-not-found", "Notification Not Found",
                    "Notification '" + id + "' was not found.");
        }
    }
}
