package com.webapp.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying HTTP semantics for RFC 7807 responses.
 * Services throw subclasses from the grouped holders; {@link GlobalExceptionHandler} renders them.
 * The slug becomes the last segment of the problem type URI.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String slug;
    private final String title;

    protected ApiException(HttpStatus status, String slug, String title, String detail) {
        super(detail);
        this.status = status;
        this.slug = slug;
        this.title = title;
    }
}
