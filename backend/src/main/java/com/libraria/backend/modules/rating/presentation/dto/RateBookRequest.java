package com.libraria.backend.modules.rating.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record RateBookRequest(
        @NotNull @Min(1) @Max(5) Integer rating,
        String review
) {
}
