package com.webapp.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Set;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {
    private String id;
    private String email;
    private String username;
    private String displayName;
    private String firstName;
    private String lastName;
    private String profileImageUrl;
    private Set<String> roles;
    private boolean emailConfirmed;
    private Instant lastLoginAt;
    private Instant createdAt;
}
