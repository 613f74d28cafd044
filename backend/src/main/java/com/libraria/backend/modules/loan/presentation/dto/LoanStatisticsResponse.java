package com.libraria.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;

public record LoanStatisticsResponse(
        long totalLoans,
        long activeLoans,
        long overdueLoans,
        long returnedLoans,
        BigDecimal returnRate
) {
}
