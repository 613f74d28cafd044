package com.libraria.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String email, List<String> roles) {

    public boolean isLibrarian() {
        return roles.contains(SecurityUtils.ROLE_LIBRARIAN);
    }
}
