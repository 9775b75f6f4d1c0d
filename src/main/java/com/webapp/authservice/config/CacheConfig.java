package com.webapp.authservice.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.KeyGenerator;
import org.springframework.cache.interceptor.SimpleKeyGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Slf4j
@Configuration
@EnableCaching
public class CacheConfig {

    /** UserDetails looked up by the JWT filter on every authenticated request. */
    public static final String USER_DETAILS_BY_EMAIL = "userDetailsByEmail";

    /**
     * Caffeine-backed manager. The TTL stays short because password changes and lockouts evict explicitly,
     * and session checks in the JWT filter cover the rest.
     */
    @Bean
    public CacheManager cacheManager(@Value("${cache.user-details.ttl:PT5M}") Duration ttl,
                                     @Value("${cache.user-details.max-size:10000}") long maxSize) {
        CaffeineCacheManager mgr = new CaffeineCacheManager();
        mgr.setCaffeine(
                Caffeine.newBuilder()
                        .maximumSize(maxSize)
                        .expireAfterWrite(ttl)
                        .recordStats()
        );
        mgr.setCacheNames(List.of(USER_DETAILS_BY_EMAIL));
        mgr.setAllowNullValues(false);
        return mgr;
    }

    /**
     * Trimmed, lower-cased key for single String arguments.
     * Referenced as {@code keyGenerator = "lowerCaseStringKeyGenerator"}.
     */
    @Bean
    public KeyGenerator lowerCaseStringKeyGenerator() {
        return (target, method, params) -> {
            if (params.length == 1 && params[0] instanceof String s) {
                return s.trim().toLowerCase(Locale.ROOT);
            }
            return SimpleKeyGenerator.generateKey(params);
        };
    }

    /** Cache faults are logged and the lookup falls through to the database. */
    @Bean
    public CacheErrorHandler cacheErrorHandler() {
        return new CacheErrorHandler() {
            @Override
            public void handleCacheGetError(@NonNull RuntimeException exception, @NonNull Cache cache,
                                            @NonNull Object key) {
                log.warn("Cache GET error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCachePutError(@NonNull RuntimeException exception, @NonNull Cache cache,
                                            @NonNull Object key, @Nullable Object value) {
                log.warn("Cache PUT error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCacheEvictError(@NonNull RuntimeException exception, @NonNull Cache cache,
                                              @NonNull Object key) {
                log.warn("Cache EVICT error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCacheClearError(@NonNull RuntimeException exception, @NonNull Cache cache) {
                log.warn("Cache CLEAR error on {}: {}", cache.getName(), exception.toString());
            }
        };
    }
}
