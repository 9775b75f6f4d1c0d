package com.webapp.authservice.dto;

public record RefreshTokenUsageStats(long total, long active, long expired, long revoked) {
}
