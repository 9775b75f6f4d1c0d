package com.webapp.authservice.SecurityConfig;

import com.webapp.authservice.entity.User;
import com.webapp.authservice.service.UserSessionService;
import io.jsonwebtoken.Claims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * Authenticates bearer access tokens. A token only authenticates when it verifies, is not blacklisted,
 * and its session is still valid; anything else leaves the request anonymous for the entry point to reject.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilterConfig extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProviderConfig jwtService;
    private final UserDetailsService userDetailsService;
    private final TokenBlacklistConfig blacklistService;
    private final UserSessionService userSessionService;
    private final Clock clock;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        final String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith(BEARER_PREFIX)
                || SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }
        final String token = authHeader.substring(BEARER_PREFIX.length()).trim();

        Optional<Claims> parsed = jwtService.validate(token);
        if (parsed.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }
        Claims claims = parsed.get();

        if (blacklistService.isBlacklisted(claims.getId())) {
            log.debug("Blacklisted access token jti={}", claims.getId());
            filterChain.doFilter(request, response);
            return;
        }

        String sessionId = claims.get(JwtTokenProviderConfig.CLAIM_SESSION_ID, String.class);
        if (!StringUtils.hasText(sessionId) || !userSessionService.touch(sessionId)) {
            log.debug("Access token bound to ended session={}", sessionId);
            filterChain.doFilter(request, response);
            return;
        }

        String email = claims.get(JwtTokenProviderConfig.CLAIM_EMAIL, String.class);
        try {
            UserDetails userDetails = userDetailsService.loadUserByUsername(email);
            if (userDetails.isEnabled() && !isLockedOut(userDetails)) {
                UsernamePasswordAuthenticationToken authToken =
                        new UsernamePasswordAuthenticationToken(userDetails, null, userDetails.getAuthorities());
                authToken.setDetails(new JwtAuthenticationDetails(
                        token,
                        sessionId,
                        claims.getId(),
                        claims.getExpiration().toInstant(),
                        request.getRemoteAddr()));
                SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
                securityContext.setAuthentication(authToken);
                SecurityContextHolder.setContext(securityContext);
            }
        } catch (UsernameNotFoundException ex) {
            log.debug("JWT principal no longer loadable: {}", ex.getMessage());
        }

        filterChain.doFilter(request, response);
    }

    private boolean isLockedOut(UserDetails userDetails) {
        if (userDetails instanceof User user) {
            return user.isLockedOut(clock.instant());
        }
        return !userDetails.isAccountNonLocked();
    }
}
