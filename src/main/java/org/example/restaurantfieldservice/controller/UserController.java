package org.example.restaurantfieldservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.UserDTO;
import org.example.restaurantfieldservice.dto.UserPreferences;
import org.example.restaurantfieldservice.dto.UserRoleRequest;
import org.example.restaurantfieldservice.dto.UserUpdateRequest;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.service.UserPreferencesService;
import org.example.restaurantfieldservice.service.UserService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final UserPreferencesService preferencesService;

    @GetMapping
    public ResponseEntity<List<UserDTO>> getUsers(@RequestParam(required = false) UserRole role,
                                                  SessionContext session) {
        return ResponseEntity.ok(userService.getUsers(role));
    }

    @GetMapping("/{id:\\d+}")
    public ResponseEntity<UserDTO> getUser(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(userService.getUser(id));
    }

    @GetMapping("/me")
    public ResponseEntity<UserDTO> getMe(SessionContext session) {
        return ResponseEntity.ok(userService.getUser(session.getUserId()));
    }

    @PutMapping("/{id:\\d+}")
    public ResponseEntity<UserDTO> updateUser(@PathVariable Long id,
                                              @Valid @RequestBody UserUpdateRequest request,
                                              SessionContext session) {
        log.info("PUT /api/users/{}", id);
        return ResponseEntity.ok(userService.updateUser(id, request, session));
    }

    @PatchMapping("/{id:\\d+}/role")
    public ResponseEntity<UserDTO> changeRole(@PathVariable Long id,
                                              @Valid @RequestBody UserRoleRequest request,
                                              SessionContext session) {
        log.info("PATCH /api/users/{}/role - {}", id, request.getRole());
        return ResponseEntity.ok(userService.changeRole(id, request.getRole(), session));
    }

    // ==================== PREFERENCES ====================

    @GetMapping("/me/preferences")
    public ResponseEntity<UserPreferences> getPreferences(SessionContext session) {
        return ResponseEntity.ok(preferencesService.getPreferences(session.getUserId()));
    }

    @PutMapping("/me/preferences")
    public ResponseEntity<UserPreferences> savePreferences(@RequestBody UserPreferences preferences,
                                                           SessionContext session) {
        return ResponseEntity.ok(preferencesService.savePreferences(session.getUserId(), preferences));
    }
}
