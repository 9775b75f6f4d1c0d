package com.webapp.authservice.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webapp.authservice.exception.ApiException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;

/**
 * Writes RFC 7807 problem bodies straight to the servlet response.
 * Shared by the MVC exception handler and the security entry points, which run outside MVC.
 * Problem types are {@value #PROBLEM_BASE} followed by a slug such as {@code account-locked}.
 */
@Component
public class ErrorResponseWriter {

    public static final String PROBLEM_BASE = "https://webapp.dev/problems/";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_ATTR = "WEBAPP_REQUEST_ID";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull ApiException ex) throws IOException {
        String detail = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : "Request could not be processed.";
        write(req, resp, ex.getStatus(), ex.getSlug(), ex.getTitle(), detail);
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      @NonNull String slug,
                      @NonNull String title,
                      @NonNull String detail) throws IOException {
        if (resp.isCommitted()) {
            return;
        }
        ProblemDetail problem = problem(req, resp, status, slug, title, detail);

        resp.setStatus(status.value());
        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("Pragma", "no-cache");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(resp.getOutputStream(), problem);
    }

    private ProblemDetail problem(HttpServletRequest req, HttpServletResponse resp, HttpStatus status,
                                  String slug, String title, String detail) {
        String path = req.getRequestURI();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(PROBLEM_BASE + slug));
        problem.setTitle(title);
        problem.setInstance(URI.create(path));
        problem.setProperty("timestamp", clock.instant().toString());
        problem.setProperty("path", path);

        String requestId = requestId(req, resp);
        if (requestId != null) {
            problem.setProperty("requestId", requestId);
        }
        return problem;
    }

    /** Response header first (set by an upstream filter), then the inbound header, then the request attribute. */
    private static String requestId(HttpServletRequest req, HttpServletResponse resp) {
        if (StringUtils.hasText(resp.getHeader(REQUEST_ID_HEADER))) {
            return resp.getHeader(REQUEST_ID_HEADER);
        }
        if (StringUtils.hasText(req.getHeader(REQUEST_ID_HEADER))) {
            return req.getHeader(REQUEST_ID_HEADER);
        }
        return req.getAttribute(REQUEST_ID_ATTR) instanceof String id && StringUtils.hasText(id) ? id : null;
    }
}
