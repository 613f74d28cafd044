package com.libraria.backend.modules.auth.presentation;

import java.util.UUID;

import com.libraria.backend.modules.auth.application.UserAccountService;
import com.libraria.backend.modules.auth.presentation.dto.UserFlagResponse;
import com.libraria.backend.modules.auth.presentation.dto.UserListResponse;
import com.libraria.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserAccountService userAccountService;

    public UserController(UserAccountService userAccountService) {
        this.userAccountService = userAccountService;
    }

    @Operation(summary = "List users", description = "Librarian only. Filters by role flags and a free-text search on name, email and username.")
    @GetMapping
    public ResponseEntity<UserListResponse> listUsers(
            @RequestParam(name = "librarian", required = false) Boolean librarian,
            @RequestParam(name = "activeMember", required = false) Boolean activeMember,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(userAccountService.listUsers(librarian, activeMember, search, page, size));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> getUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(userAccountService.loadProfile(userId));
    }

    @PostMapping("/{userId}/toggle-librarian")
    public ResponseEntity<UserFlagResponse> toggleLibrarian(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(userAccountService.toggleLibrarian(userId));
    }

    @PostMapping("/{userId}/toggle-active")
    public ResponseEntity<UserFlagResponse> toggleActive(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(userAccountService.toggleActiveMember(userId));
    }
}
