package com.webapp.authservice.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Housekeeping runs unless {@code housekeeping.enabled=false} (tests switch it off).
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "housekeeping.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
