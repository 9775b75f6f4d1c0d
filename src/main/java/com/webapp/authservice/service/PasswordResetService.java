package com.webapp.authservice.service;

import com.webapp.authservice.entity.User;

import java.time.Instant;

public interface PasswordResetService {

    /** Invalidates outstanding tokens for the user and returns a new raw token. */
    String issue(User user);

    /** Marks the matching token used and returns its user; fails with InvalidResetToken otherwise. */
    User consume(String email, String rawToken);

    int purgeExpired(Instant now);
}
