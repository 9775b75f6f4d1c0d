package com.webapp.authservice.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Where a request came from; recorded on sessions and refresh tokens. Every field may be null.
 */
@Value
@Builder(toBuilder = true)
public class ClientContext {
    String ipAddress;
    String userAgent;
    String deviceInfo;
    String location;

    public static ClientContext unknown() {
        return ClientContext.builder().build();
    }
}
