package org.example.restaurantfieldservice.security;

import org.example.restaurantfieldservice.dto.AuthResponse;
import org.example.restaurantfieldservice.dto.SignInRequest;
import org.example.restaurantfieldservice.dto.SignUpRequest;
import org.example.restaurantfieldservice.entity.AppUser;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.exception.AuthenticationException;
import org.example.restaurantfieldservice.exception.DuplicateResourceException;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.AppUserRepository;
import org.example.restaurantfieldservice.session.SessionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService")
class AuthServiceTest {

    private static final String SECRET = "test-signing-secret-with-enough-bytes-for-hs256";

    @Mock private AppUserRepository userRepository;
    @Mock private StringRedisTemplate redisTemplate;
    @Mock private ValueOperations<String, String> valueOperations;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private final JwtService jwtService = new JwtService(SECRET, 1);
    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(userRepository, passwordEncoder, jwtService, redisTemplate, new ResourceMapper());
    }

    private AppUser technician() {
        return AppUser.builder()
                .id(7L)
                .name("Tina")
                .email("tech@fieldservice.local")
                .passwordHash(passwordEncoder.encode("password123"))
                .role(UserRole.TECHNICIAN)
                .build();
    }

    @Nested
    @DisplayName("signUp")
    class SignUp {

        @Test
        @DisplayName("defaults to technician and stores only the password hash")
        void createsTechnician() {
            when(userRepository.existsByEmailIgnoreCase("new@fieldservice.local")).thenReturn(false);
            when(userRepository.save(any(AppUser.class))).thenAnswer(inv -> {
                AppUser u = inv.getArgument(0);
                u.setId(12L);
                return u;
            });

            AuthResponse response = authService.signUp(SignUpRequest.builder()
                    .name(" New Tech ").email("New@FieldService.local").password("password123").build());

            ArgumentCaptor<AppUser> saved = ArgumentCaptor.forClass(AppUser.class);
            verify(userRepository).save(saved.capture());
            assertThat(saved.getValue().getRole()).isEqualTo(UserRole.TECHNICIAN);
            assertThat(saved.getValue().getEmail()).isEqualTo("new@fieldservice.local");
            assertThat(saved.getValue().getPasswordHash()).isNotEqualTo("password123");
            assertThat(passwordEncoder.matches("password123", saved.getValue().getPasswordHash())).isTrue();

            assertThat(response.getToken()).isNotBlank();
            assertThat(response.getTokenType()).isEqualTo("Bearer");
            assertThat(response.getUser().getName()).isEqualTo("New Tech");
        }

        @Test
        void adminAccountsCannotBeSelfCreated() {
            assertThatThrownBy(() -> authService.signUp(SignUpRequest.builder()
                    .name("Eve").email("eve@x.io").password("password123").role(UserRole.ADMIN).build()))
                    .isInstanceOf(PermissionDeniedException.class);
            verify(userRepository, never()).save(any());
        }

        @Test
        void duplicateEmailIsRejected() {
            when(userRepository.existsByEmailIgnoreCase("tech@fieldservice.local")).thenReturn(true);

            assertThatThrownBy(() -> authService.signUp(SignUpRequest.builder()
                    .name("Tina").email("tech@fieldservice.local").password("password123").build()))
                    .isInstanceOf(DuplicateResourceException.class);
        }
    }

    @Nested
    @DisplayName("signIn and sessions")
    class Sessions {

        @Test
        @DisplayName("the issued token resolves to the user's session")
        void tokenRoundTrip() {
            when(userRepository.findByEmailIgnoreCase("tech@fieldservice.local")).thenReturn(Optional.of(technician()));
            when(redisTemplate.hasKey(anyString())).thenReturn(false);

            AuthResponse response = authService.signIn(new SignInRequest("tech@fieldservice.local", "password123"));
            SessionContext session = authService.resolveSession(response.getToken());

            assertThat(session.getUserId()).isEqualTo(7L);
            assertThat(session.getRole()).isEqualTo(UserRole.TECHNICIAN);
            assertThat(session.getEmail()).isEqualTo("tech@fieldservice.local");
            assertThat(session.isManagerOrAdmin()).isFalse();
        }

        @Test
        void wrongPasswordIsRejected() {
            when(userRepository.findByEmailIgnoreCase("tech@fieldservice.local")).thenReturn(Optional.of(technician()));

            assertThatThrownBy(() -> authService.signIn(new SignInRequest("tech@fieldservice.local", "nope")))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("Invalid email or password");
        }

        @Test
        void tokenFromAnotherKeyIsRejected() {
            String foreign = new JwtService("another-signing-secret-with-enough-bytes-too", 1)
                    .issue(technician()).getToken();

            assertThatThrownBy(() -> authService.resolveSession(foreign))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("Invalid or expired token");
        }

        @Test
        @DisplayName("a signed-out token no longer resolves")
        void signOutRevokes() {
            String token = jwtService.issue(technician()).getToken();
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);

            authService.signOut(token);

            ArgumentCaptor<Duration> ttl = ArgumentCaptor.forClass(Duration.class);
            verify(valueOperations).set(anyString(), eq("1"), ttl.capture());
            assertThat(ttl.getValue()).isPositive().isLessThanOrEqualTo(Duration.ofHours(1));

            when(redisTemplate.hasKey(anyString())).thenReturn(true);
            assertThatThrownBy(() -> authService.resolveSession(token))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("Session has been signed out");
        }

        @Test
        @DisplayName("an unreachable revocation store does not lock users out")
        void revocationCheckFailsOpen() {
            String token = jwtService.issue(technician()).getToken();
            when(redisTemplate.hasKey(anyString())).thenThrow(new RedisConnectionFailureException("down"));

            assertThat(authService.resolveSession(token).getUserId()).isEqualTo(7L);
        }

        @Test
        void signOutWithGarbageIsIgnored() {
            authService.signOut("not-a-jwt");

            verify(redisTemplate, never()).opsForValue();
        }
    }

    @Nested
    @DisplayName("changePassword")
    class ChangePassword {

        private final SessionContext session = SessionContext.builder()
                .userId(7L).email("tech@fieldservice.local").role(UserRole.TECHNICIAN).build();

        @Test
        @DisplayName("stores a new hash once the current password is confirmed")
        void rehashesNewPassword() {
            AppUser user = technician();
            when(userRepository.findById(7L)).thenReturn(Optional.of(user));

            authService.changePassword(session, "password123", "correct-horse-battery");

            ArgumentCaptor<AppUser> saved = ArgumentCaptor.forClass(AppUser.class);
            verify(userRepository).save(saved.capture());
            String hash = saved.getValue().getPasswordHash();
            assertThat(hash).isNotEqualTo("correct-horse-battery");
            assertThat(passwordEncoder.matches("correct-horse-battery", hash)).isTrue();
            assertThat(passwordEncoder.matches("password123", hash)).isFalse();
        }

        @Test
        @DisplayName("a wrong current password leaves the stored hash alone")
        void wrongCurrentPassword() {
            when(userRepository.findById(7L)).thenReturn(Optional.of(technician()));

            assertThatThrownBy(() -> authService.changePassword(session, "guess", "correct-horse-battery"))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("Current password is incorrect");
            verify(userRepository, never()).save(any());
        }
    }
}
