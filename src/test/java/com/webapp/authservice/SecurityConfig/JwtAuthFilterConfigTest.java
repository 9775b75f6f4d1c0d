package com.webapp.authservice.SecurityConfig;

import com.webapp.authservice.entity.User;
import com.webapp.authservice.service.UserSessionService;
import com.webapp.authservice.support.TestUsers;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetailsService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JwtAuthFilterConfigTest {

    private static final Instant NOW = Instant.parse("2030-01-15T12:00:00Z");

    @Mock
    private JwtTokenProviderConfig jwtService;
    @Mock
    private UserDetailsService userDetailsService;
    @Mock
    private TokenBlacklistConfig blacklistService;
    @Mock
    private UserSessionService userSessionService;

    private JwtAuthFilterConfig filter;
    private User user;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        filter = new JwtAuthFilterConfig(jwtService, userDetailsService, blacklistService, userSessionService,
                Clock.fixed(NOW, ZoneOffset.UTC));
        user = TestUsers.confirmed("alice");
        request = new MockHttpServletRequest("GET", "/auth/me");
        request.addHeader("Authorization", "Bearer access-token");
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private Claims claims() {
        return Jwts.claims()
                .id("jti-1")
                .subject(user.getId().toString())
                .expiration(Date.from(NOW.plusSeconds(600)))
                .add(JwtTokenProviderConfig.CLAIM_EMAIL, user.getEmail())
                .add(JwtTokenProviderConfig.CLAIM_SESSION_ID, "session-1")
                .build();
    }

    @Test
    void validTokenWithLiveSessionAuthenticates() throws Exception {
        when(jwtService.validate("access-token")).thenReturn(Optional.of(claims()));
        when(userSessionService.touch("session-1")).thenReturn(true);
        when(userDetailsService.loadUserByUsername("alice@example.com")).thenReturn(user);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth).isNotNull();
        assertThat(auth.getPrincipal()).isSameAs(user);
        assertThat(auth.getDetails()).isInstanceOfSatisfying(JwtAuthenticationDetails.class, d -> {
            assertThat(d.sessionId()).isEqualTo("session-1");
            assertThat(d.accessToken()).isEqualTo("access-token");
        });
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void blacklistedTokenStaysAnonymous() throws Exception {
        when(jwtService.validate("access-token")).thenReturn(Optional.of(claims()));
        when(blacklistService.isBlacklisted("jti-1")).thenReturn(true);

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verifyNoInteractions(userSessionService, userDetailsService);
    }

    @Test
    void endedSessionStaysAnonymous() throws Exception {
        when(jwtService.validate("access-token")).thenReturn(Optional.of(claims()));
        when(userSessionService.touch("session-1")).thenReturn(false);

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verifyNoInteractions(userDetailsService);
    }

    @Test
    void lockedPrincipalIsNotAuthenticated() throws Exception {
        user.setLockoutEndAt(NOW.plusSeconds(600));
        when(jwtService.validate("access-token")).thenReturn(Optional.of(claims()));
        when(userSessionService.touch("session-1")).thenReturn(true);
        when(userDetailsService.loadUserByUsername("alice@example.com")).thenReturn(user);

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void lockoutIsJudgedAgainstTheInjectedClock() throws Exception {
        // Over by the service clock, still ahead of the wall clock.
        user.setLockoutEndAt(NOW.minus(Duration.ofMinutes(1)));
        when(jwtService.validate("access-token")).thenReturn(Optional.of(claims()));
        when(userSessionService.touch("session-1")).thenReturn(true);
        when(userDetailsService.loadUserByUsername("alice@example.com")).thenReturn(user);

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNotNull();
    }

    @Test
    void requestWithoutBearerHeaderPassesThrough() throws Exception {
        MockHttpServletRequest anonymous = new MockHttpServletRequest("GET", "/auth/validate");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(anonymous, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(anonymous);
        verifyNoInteractions(jwtService);
    }
}
