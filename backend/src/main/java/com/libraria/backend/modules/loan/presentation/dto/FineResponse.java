package com.libraria.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

public record FineResponse(
        UUID loanId,
        BigDecimal fineAmount,
        long daysOverdue,
        boolean finePaid
) {
}
