package com.libraria.backend.modules.auth.presentation;

import com.libraria.backend.modules.auth.application.AuthService;
import com.libraria.backend.modules.auth.presentation.dto.AuthResponse;
import com.libraria.backend.modules.auth.presentation.dto.LoginRequest;
import com.libraria.backend.modules.auth.presentation.dto.RegisterRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register a library member", description = "Creates a member account and returns an access token.")
    @PostMapping("/auth/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(201).body(authService.register(request));
    }

    @PostMapping("/auth/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
}
