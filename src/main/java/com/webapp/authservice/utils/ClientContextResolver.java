package com.webapp.authservice.utils;

import com.webapp.authservice.dto.ClientContext;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Locale;

public final class ClientContextResolver {

    static final String LOCATION_HEADER = "X-Client-Location";

    private ClientContextResolver() {}

    public static ClientContext resolve(HttpServletRequest request) {
        String userAgent = truncate(request.getHeader("User-Agent"), 255);
        return ClientContext.builder()
                .ipAddress(clientIp(request))
                .userAgent(userAgent)
                .deviceInfo(deviceInfo(userAgent))
                .location(truncate(request.getHeader(LOCATION_HEADER), 100))
                .build();
    }

    /** First hop of X-Forwarded-For when a proxy set it, otherwise the socket address. */
    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) return truncate(first, 45);
        }
        return truncate(request.getRemoteAddr(), 45);
    }

    static String deviceInfo(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return "Unknown";
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        if (ua.contains("ipad") || ua.contains("tablet")) {
            return "Tablet";
        }
        if (ua.contains("mobile") || ua.contains("android") || ua.contains("iphone")) {
            return "Mobile";
        }
        if (ua.contains("windows") || ua.contains("macintosh") || ua.contains("linux")) {
            return "Desktop";
        }
        return "Unknown";
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        String t = s.trim();
        if (t.isEmpty()) return null;
        return t.length() > max ? t.substring(0, max) : t;
    }
}
