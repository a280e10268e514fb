package org.example.restaurantfieldservice.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.AuthResponse;
import org.example.restaurantfieldservice.dto.SignInRequest;
import org.example.restaurantfieldservice.dto.SignUpRequest;
import org.example.restaurantfieldservice.dto.UserDTO;
import org.example.restaurantfieldservice.entity.AppUser;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.exception.AuthenticationException;
import org.example.restaurantfieldservice.exception.DuplicateResourceException;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.AppUserRepository;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

/**
 * Email and password accounts with JWT bearer sessions.
 *
 * <p>Signed-out tokens are remembered under {@code auth:revoked:{jti}} until they
 * would have expired anyway.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String REVOKED_PREFIX = "auth:revoked:";

    private final AppUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final StringRedisTemplate redisTemplate;
    private final ResourceMapper mapper;

    // ==================== SIGN UP / SIGN IN ====================

    /**
     * @throws PermissionDeniedException  if the request asks for an admin account
     * @throws DuplicateResourceException if the email is taken
     */
    @Transactional
    public AuthResponse signUp(SignUpRequest request) {
        if (request.getRole() == UserRole.ADMIN) {
            throw new PermissionDeniedException("Administrator accounts cannot be created through sign-up");
        }
        String email = request.getEmail().trim().toLowerCase();
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new DuplicateResourceException("User", "email", email);
        }

        AppUser user = userRepository.save(AppUser.builder()
                .name(request.getName().trim())
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .role(request.getRole() != null ? request.getRole() : UserRole.TECHNICIAN)
                .phone(request.getPhone())
                .build());

        log.info("👤 User signed up - id: {}, role: {}", user.getId(), user.getRole());
        return respond(user);
    }

    @Transactional(readOnly = true)
    public AuthResponse signIn(SignInRequest request) {
        AppUser user = userRepository.findByEmailIgnoreCase(request.getEmail().trim())
                .filter(u -> passwordEncoder.matches(request.getPassword(), u.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("⛔ Failed sign-in for {}", request.getEmail());
                    return new AuthenticationException("Invalid email or password");
                });

        log.info("🔓 User {} signed in", user.getId());
        return respond(user);
    }

    // ==================== SESSION ====================

    /**
     * @throws AuthenticationException if the token is invalid, expired or revoked
     */
    public SessionContext resolveSession(String token) {
        Claims claims;
        try {
            claims = jwtService.parse(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw new AuthenticationException("Invalid or expired token", e);
        }
        if (isRevoked(claims.getId())) {
            throw new AuthenticationException("Session has been signed out");
        }

        return SessionContext.builder()
                .userId(claims.get(JwtService.CLAIM_USER_ID, Long.class))
                .email(claims.getSubject())
                .name(claims.get(JwtService.CLAIM_NAME, String.class))
                .role(UserRole.valueOf(claims.get(JwtService.CLAIM_ROLE, String.class)))
                .build();
    }

    @Transactional(readOnly = true)
    public UserDTO currentUser(SessionContext session) {
        return userRepository.findById(session.getUserId())
                .map(mapper::toDTO)
                .orElseThrow(() -> new ResourceNotFoundException("User", session.getUserId()));
    }

    /**
     * @throws AuthenticationException if {@code currentPassword} does not match the stored hash
     */
    @Transactional
    public void changePassword(SessionContext session, String currentPassword, String newPassword) {
        AppUser user = userRepository.findById(session.getUserId())
                .orElseThrow(() -> new ResourceNotFoundException("User", session.getUserId()));
        if (!passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            log.warn("⛔ Wrong current password on password change for {}", user.getId());
            throw new AuthenticationException("Current password is incorrect");
        }
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        userRepository.save(user);
        log.info("🔑 Password changed for user {}", user.getId());
    }

    /**
     * @throws IllegalStateException if the revocation could not be stored
     */
    public void signOut(String token) {
        Claims claims;
        try {
            claims = jwtService.parse(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Sign-out with an unusable token: {}", e.getMessage());
            return;
        }

        Duration remaining = Duration.between(Instant.now(), claims.getExpiration().toInstant());
        if (remaining.isNegative() || remaining.isZero()) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(REVOKED_PREFIX + claims.getId(), "1", remaining);
            log.info("🔒 Session {} signed out", claims.getId());
        } catch (Exception e) {
            log.error("❌ REDIS ERROR - Could not revoke session {}: {}", claims.getId(), e.getMessage());
            throw new IllegalStateException("Sign-out could not be recorded", e);
        }
    }

    // ==================== HELPERS ====================

    private boolean isRevoked(String tokenId) {
        if (tokenId == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(REVOKED_PREFIX + tokenId));
        } catch (Exception e) {
            log.warn("⚠️ REDIS ERROR - Could not check revocation of {}: {}", tokenId, e.getMessage());
            return false;
        }
    }

    private AuthResponse respond(AppUser user) {
        JwtService.IssuedToken issued = jwtService.issue(user);
        return AuthResponse.builder()
                .token(issued.getToken())
                .expiresAt(issued.getExpiresAt())
                .user(mapper.toDTO(user))
                .build();
    }
}
