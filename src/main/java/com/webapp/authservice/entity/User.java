package com.webapp.authservice.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.io.Serial;
import java.io.Serializable;
import java.security.Principal;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;

@Entity
@Table(name = "users")
@NoArgsConstructor
@AllArgsConstructor
@Setter
@Getter
@SuperBuilder
public class User extends BaseEntity implements UserDetails, Principal, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    @NotBlank(message = "Email is required")
    @Size(max = 254, message = "Email must not exceed 254 characters")
    @Email(message = "Email should be valid")
    @Column(unique = true, nullable = false, length = 254)
    private String email;

    @NotBlank(message = "Username is required")
    @Size(min = 3, max = 30)
    @Column(unique = true, nullable = false, length = 30)
    private String username;

    /** BCrypt hash; the raw password never reaches this entity. */
    @Column(name = "password_hash", nullable = false)
    @JsonIgnore
    private String password;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 30)
    @Builder.Default
    private UserRole role = UserRole.ROLE_USER;

    @OneToOne(mappedBy = "user", cascade = CascadeType.ALL, orphanRemoval = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Profile profile;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    @Builder.Default
    @Column(name = "email_confirmed", nullable = false)
    private boolean emailConfirmed = false;

    @JsonIgnore
    @Column(name = "email_confirmation_token_hash", length = 64)
    private String emailConfirmationTokenHash;

    @Builder.Default
    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts = 0;

    @Column(name = "lockout_end_at")
    private Instant lockoutEndAt;

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    @Column(name = "password_changed_at")
    private Instant passwordChangedAt;

    public boolean isLockedOut(Instant now) {
        return lockoutEndAt != null && lockoutEndAt.isAfter(now);
    }

    /**
     * Counts a failed password check. Reaching {@code maxAttempts} starts a lockout and resets the counter.
     *
     * @return true when this attempt triggered a lockout
     */
    public boolean recordFailedLogin(Instant now, int maxAttempts, Duration lockoutDuration) {
        failedLoginAttempts++;
        if (failedLoginAttempts >= maxAttempts) {
            lockoutEndAt = now.plus(lockoutDuration);
            failedLoginAttempts = 0;
            return true;
        }
        return false;
    }

    public void recordSuccessfulLogin(Instant now) {
        failedLoginAttempts = 0;
        lockoutEndAt = null;
        lastLoginAt = now;
    }

    public void clearLockout() {
        failedLoginAttempts = 0;
        lockoutEndAt = null;
    }

    public void changePassword(String newHash, Instant now) {
        this.password = newHash;
        this.passwordChangedAt = now;
    }

    public void confirmEmail() {
        this.emailConfirmed = true;
        this.emailConfirmationTokenHash = null;
    }

    public String getDisplayName() {
        if (profile != null && profile.getDisplayName() != null && !profile.getDisplayName().isBlank()) {
            return profile.getDisplayName();
        }
        return username;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return Set.of(new SimpleGrantedAuthority(role.name()));
    }

    /**
     * Spring Security's username is the login email; the public handle is {@link #getHandle()}.
     */
    @Override
    public String getUsername() {
        return email;
    }

    public String getHandle() {
        return username;
    }

    @Override
    public boolean isAccountNonLocked() {
        return !isLockedOut(Instant.now());
    }

    @Override
    public boolean isEnabled() {
        return enabled && !isDeleted();
    }

    @Override
    public String getName() {
        return email;
    }

    public boolean isAdmin() {
        return role == UserRole.ROLE_ADMIN;
    }
}
