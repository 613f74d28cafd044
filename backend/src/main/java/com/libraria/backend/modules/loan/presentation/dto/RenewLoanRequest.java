package com.libraria.backend.modules.loan.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * {@code days} defaults to 14 when omitted.
 */
public record RenewLoanRequest(
        @Min(1) @Max(30) Integer days
) {
}
