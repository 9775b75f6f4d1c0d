package com.webapp.authservice.exception;

import com.webapp.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps every failure leaving a controller to a problem body.
 * Bean Validation failures are 422; a body or parameter Spring cannot bind is 400.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final int MAX_VIOLATIONS = 5;

    private final ErrorResponseWriter writer;

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        log.debug("{} {} -> {} {}", req.getMethod(), req.getRequestURI(), ex.getStatus().value(), ex.getSlug());
        writer.write(req, resp, ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleInvalidBody(@NonNull HttpServletRequest req,
                                  @NonNull HttpServletResponse resp,
                                  @NonNull MethodArgumentNotValidException ex) throws IOException {
        Stream<String> fields = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"));
        Stream<String> objects = ex.getBindingResult().getGlobalErrors().stream()
                .map(ge -> ge.getDefaultMessage() != null ? ge.getDefaultMessage() : "invalid");
        writeValidationProblem(req, resp, Stream.concat(fields, objects));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleInvalidParameters(@NonNull HttpServletRequest req,
                                        @NonNull HttpServletResponse resp,
                                        @NonNull ConstraintViolationException ex) throws IOException {
        writeValidationProblem(req, resp, ex.getConstraintViolations().stream()
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage()));
    }

    @ExceptionHandler({ServletRequestBindingException.class, HttpMessageNotReadableException.class})
    public void handleUnreadableRequest(@NonNull HttpServletRequest req,
                                        @NonNull HttpServletResponse resp,
                                        @NonNull Exception ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST, "bad-request", "Bad Request",
                "Malformed or missing request parameters.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST, "type-mismatch", "Type Mismatch",
                "Parameter '" + ex.getName() + "' has invalid type.");
    }

    /** Routing failures already know their status; the slug is derived from its reason phrase. */
    @ExceptionHandler({NoHandlerFoundException.class,
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class})
    public void handleRoutingFailure(@NonNull HttpServletRequest req,
                                     @NonNull HttpServletResponse resp,
                                     @NonNull Exception ex) throws IOException {
        HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
        String slug = status.getReasonPhrase().toLowerCase(Locale.ROOT).replace(' ', '-');
        writer.write(req, resp, status, slug, status.getReasonPhrase(),
                "No handler accepts " + req.getMethod() + " " + req.getRequestURI() + " as sent.");
    }

    /** A unique index (email, username) raced past the service-level existence check. */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleDataIntegrity(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull DataIntegrityViolationException ex) throws IOException {
        log.warn("Constraint violation on {} {}: {}", req.getMethod(), req.getRequestURI(),
                ex.getMostSpecificCause().getMessage());
        writer.write(req, resp, HttpStatus.CONFLICT, "conflict", "Conflict",
                "A conflicting resource already exists or violates a constraint.");
    }

    @ExceptionHandler(Exception.class)
    public void handleUnexpected(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        log.error("Unhandled exception on {} {}", req.getMethod(), req.getRequestURI(), ex);
        writer.write(req, resp, HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", "Internal Server Error",
                "An unexpected error occurred.");
    }

    private void writeValidationProblem(HttpServletRequest req, HttpServletResponse resp,
                                        Stream<String> violations) throws IOException {
        String detail = violations.limit(MAX_VIOLATIONS).collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.UNPROCESSABLE_ENTITY, "validation-error", "Validation Error",
                detail.isBlank() ? "Request validation failed." : detail);
    }
}
