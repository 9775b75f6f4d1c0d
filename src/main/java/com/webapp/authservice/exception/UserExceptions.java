package com.webapp.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * User-domain exceptions (registration, profile lifecycle, credential changes).
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 Not Found – User record not present. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound(String detail) {
            super(HttpStatus.NOT_FOUND, "user-not-found", "User Not Found", detail);
        }
    }

    /** 409 Conflict – Email already registered. */
    public static final class UserAlreadyExists extends ApiException {
        public UserAlreadyExists(String email) {
            super(HttpStatus.CONFLICT, "user-already-exists", "User Already Exists",
                    "User with email '" + email + "' already exists.");
        }
    }

    /** 409 Conflict – Username already taken. */
    public static final class UsernameTaken extends ApiException {
        public UsernameTaken(String username) {
            super(HttpStatus.CONFLICT, "username-taken", "Username Taken",
                    "Username '" + username + "' is already taken.");
        }
    }

    /** 400 Bad Request – Input rejected by a user rule (e.g. new password equals the current one). */
    public static final class InvalidUserInput extends ApiException {
        public InvalidUserInput(String detail) {
            super(HttpStatus.BAD_REQUEST, "invalid-user-input", "Invalid User Input", detail);
        }
    }
}
