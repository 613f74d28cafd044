package com.libraria.backend.modules.auth.presentation.dto;

import java.util.List;

public record UserListResponse(
        List<UserProfileResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
