package com.libraria.backend.modules.auth.presentation.dto;

public record AuthResponse(
        TokenResponse tokens,
        UserProfileResponse user
) {
}
