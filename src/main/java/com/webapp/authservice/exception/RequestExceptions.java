package com.webapp.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Problems with the incoming request itself.
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 Bad Request – A parameter is missing, blank or out of range. */
    public static final class InvalidParameter extends ApiException {
        public InvalidParameter(String detail) {
            super(HttpStatus.BAD_REQUEST, "invalid-parameter", "Invalid Parameter", detail);
        }
    }
}
