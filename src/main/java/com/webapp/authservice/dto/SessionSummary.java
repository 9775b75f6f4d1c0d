package com.webapp.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionSummary {
    private String sessionId;
    private String ipAddress;
    private String userAgent;
    private String deviceInfo;
    private String location;
    private Instant createdAt;
    private Instant lastActivityAt;
    private Instant expiresAt;
    private boolean current;
}
