package com.webapp.authservice.serviceImpl;

import com.webapp.authservice.config.CacheConfig;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserDetailsService {

    private final UserRepository userRepository;

    /**
     * Loads by login email. Soft-deleted accounts are reported as missing;
     * enabled and lockout state are checked by the caller on the returned {@link User}.
     */
    @Override
    @Transactional(readOnly = true)
    @Cacheable(
            cacheNames = CacheConfig.USER_DETAILS_BY_EMAIL,
            keyGenerator = "lowerCaseStringKeyGenerator",
            unless = "#result == null",
            sync = true
    )
    public UserDetails loadUserByUsername(String email) throws UsernameNotFoundException {
        final String normalized = normalizeEmail(email);
        log.debug("Loading user by email: {}", normalized);

        User user = userRepository.findByEmail(normalized)
                .orElseThrow(() -> new UsernameNotFoundException("User not found"));

        if (user.isDeleted()) {
            throw new UsernameNotFoundException("User not found");
        }
        return user;
    }

    /** Drops the cached principal after a change to credentials, lockout or confirmation state. */
    @CacheEvict(cacheNames = CacheConfig.USER_DETAILS_BY_EMAIL, keyGenerator = "lowerCaseStringKeyGenerator")
    public void evictUserDetails(String email) {
        log.debug("Evicted cached user details for {}", email);
    }

    private String normalizeEmail(String email) {
        if (email == null) throw new UsernameNotFoundException("User not found");
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
