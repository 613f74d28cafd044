package com.libraria.backend.modules.rating.presentation.dto;

import java.util.List;

public record RatingListResponse(
        List<RatingResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
