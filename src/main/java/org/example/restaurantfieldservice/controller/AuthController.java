package org.example.restaurantfieldservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.AuthResponse;
import org.example.restaurantfieldservice.dto.ChangePasswordRequest;
import org.example.restaurantfieldservice.dto.SignInRequest;
import org.example.restaurantfieldservice.dto.SignUpRequest;
import org.example.restaurantfieldservice.dto.UserDTO;
import org.example.restaurantfieldservice.security.AuthService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.example.restaurantfieldservice.web.SessionContextArgumentResolver;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/sign-up")
    public ResponseEntity<AuthResponse> signUp(@Valid @RequestBody SignUpRequest request) {
        log.info("POST /api/auth/sign-up");
        return new ResponseEntity<>(authService.signUp(request), HttpStatus.CREATED);
    }

    @PostMapping("/sign-in")
    public ResponseEntity<AuthResponse> signIn(@Valid @RequestBody SignInRequest request) {
        log.info("POST /api/auth/sign-in");
        return ResponseEntity.ok(authService.signIn(request));
    }

    /**
     * Current user behind the bearer token.
     */
    @GetMapping("/session")
    public ResponseEntity<UserDTO> getSession(SessionContext session) {
        return ResponseEntity.ok(authService.currentUser(session));
    }

    @PostMapping("/password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request,
                                               SessionContext session) {
        log.info("POST /api/auth/password - user: {}", session.getUserId());
        authService.changePassword(session, request.getCurrentPassword(), request.getNewPassword());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sign-out")
    public ResponseEntity<Void> signOut(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        log.info("POST /api/auth/sign-out");
        authService.signOut(SessionContextArgumentResolver.extractToken(authorization));
        return ResponseEntity.noContent().build();
    }
}
