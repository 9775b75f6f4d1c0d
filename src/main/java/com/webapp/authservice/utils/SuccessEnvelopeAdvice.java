package com.webapp.authservice.utils;

import com.webapp.authservice.model.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.core.io.Resource;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps successful JSON responses in {@link ApiResponse}.
 * Problem details, non-2xx statuses, already-wrapped bodies, binary bodies and the springdoc endpoints pass through.
 * A {@link Page} body is unwrapped into {@code data} = content and {@code meta} = paging info.
 */
@RestControllerAdvice(basePackages = "com.webapp.authservice.controller")
@RequiredArgsConstructor
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    private final Clock clock;

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType selectedContentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {

        if (body instanceof ProblemDetail) return body;
        if (!isJsonLike(selectedContentType)) return body;
        if (shouldSkip(body)) return body;

        if (response instanceof ServletServerHttpResponse sResp) {
            HttpStatus status = HttpStatus.resolve(sResp.getServletResponse().getStatus());
            if (status != null && !status.is2xxSuccessful()) return body;
        }

        String message = resolveMessage(returnType);
        String requestId = requestId(request, response);
        Instant now = Instant.now(clock);

        if (body instanceof Page<?> page) {
            return ApiResponse.of(now, requestId, message, page.getContent(), pageMeta(page));
        }
        return ApiResponse.of(now, requestId, message, body, null);
    }

    private boolean shouldSkip(@Nullable Object body) {
        return body == null
                || body instanceof ApiResponse<?>
                || body instanceof byte[]
                || body instanceof Resource;
    }

    private boolean isJsonLike(@NonNull MediaType mt) {
        if (MediaType.APPLICATION_PROBLEM_JSON.includes(mt)) return false;
        return MediaType.APPLICATION_JSON.includes(mt) || mt.getSubtype().endsWith("+json");
    }

    private String resolveMessage(@NonNull MethodParameter returnType) {
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        if (ann == null) {
            ann = returnType.getContainingClass().getAnnotation(ResponseMessage.class);
        }
        return (ann != null && StringUtils.hasText(ann.value())) ? ann.value() : "OK";
    }

    private String requestId(@NonNull ServerHttpRequest req, @NonNull ServerHttpResponse resp) {
        String id = req.getHeaders().getFirst(ErrorResponseWriter.REQUEST_ID_HEADER);
        if (!StringUtils.hasText(id)) {
            id = resp.getHeaders().getFirst(ErrorResponseWriter.REQUEST_ID_HEADER);
        }
        if (!StringUtils.hasText(id) && req instanceof ServletServerHttpRequest sreq) {
            Object attr = sreq.getServletRequest().getAttribute(ErrorResponseWriter.REQUEST_ID_ATTR);
            if (attr instanceof String s && StringUtils.hasText(s)) id = s;
        }
        return id;
    }

    private Map<String, Object> pageMeta(Page<?> page) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("page", page.getNumber());
        meta.put("size", page.getSize());
        meta.put("totalItems", page.getTotalElements());
        meta.put("totalPages", page.getTotalPages());
        if (page.getSort().isSorted()) {
            meta.put("sort", page.getSort().toString());
        }
        return meta;
    }
}
