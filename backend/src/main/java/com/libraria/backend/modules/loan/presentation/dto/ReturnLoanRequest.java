package com.libraria.backend.modules.loan.presentation.dto;

import com.libraria.backend.modules.loan.domain.ReturnCondition;

public record ReturnLoanRequest(
        ReturnCondition condition,
        String notes
) {
}
