package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.ChangeRoleRequest;
import com.cred.freestyle.jewelryauction.api.dto.CredentialsRequest;
import com.cred.freestyle.jewelryauction.api.dto.RegisterUserRequest;
import com.cred.freestyle.jewelryauction.api.dto.UserResponse;
import com.cred.freestyle.jewelryauction.domain.model.User;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.UserService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for user registration and administration.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    /**
     * Register a new member. Public.
     */
    @PostMapping
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterUserRequest request) {
        User user = userService.register(
                request.getName(),
                request.getEmail(),
                request.getPassword(),
                request.getPhone(),
                request.getAddress()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.fromEntity(user));
    }

    /**
     * Verify an email and password. Public; answers 401 on any mismatch.
     */
    @PostMapping("/credentials/verify")
    public ResponseEntity<UserResponse> verifyCredentials(@Valid @RequestBody CredentialsRequest request) {
        User user = userService.verifyCredentials(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(UserResponse.fromEntity(user));
    }

    @GetMapping("/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> me() {
        String userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(UserResponse.fromEntity(userService.get(userId, SecurityUtils.currentActor())));
    }

    @GetMapping("/{userId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> getUser(@PathVariable String userId) {
        return ResponseEntity.ok(UserResponse.fromEntity(userService.get(userId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{userId}/deactivate")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> deactivate(@PathVariable String userId) {
        return ResponseEntity.ok(UserResponse.fromEntity(userService.deactivate(userId, SecurityUtils.currentActor())));
    }

    @PutMapping("/{userId}/role")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> changeRole(
            @PathVariable String userId,
            @Valid @RequestBody ChangeRoleRequest request
    ) {
        User user = userService.changeRole(userId, request.getRole(), SecurityUtils.currentActor());
        return ResponseEntity.ok(UserResponse.fromEntity(user));
    }
}
