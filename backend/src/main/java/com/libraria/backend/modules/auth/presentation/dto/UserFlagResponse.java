package com.libraria.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record UserFlagResponse(
        UUID userId,
        String message,
        boolean librarian,
        boolean activeMember
) {
}
