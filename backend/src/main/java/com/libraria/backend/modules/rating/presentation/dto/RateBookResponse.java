package com.libraria.backend.modules.rating.presentation.dto;

import java.math.BigDecimal;

public record RateBookResponse(
        boolean created,
        RatingResponse rating,
        BigDecimal bookAverageRating,
        int bookTotalRatings
) {
}
