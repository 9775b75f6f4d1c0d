package com.webapp.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenValidationResponse {
    private boolean valid;
    private String userId;
    private String username;
    private String email;
    private String sessionId;
    private Instant expiresAt;

    public static TokenValidationResponse invalid() {
        return TokenValidationResponse.builder().valid(false).build();
    }
}
