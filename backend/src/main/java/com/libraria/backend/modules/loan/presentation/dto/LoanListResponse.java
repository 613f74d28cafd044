package com.libraria.backend.modules.loan.presentation.dto;

import java.util.List;

public record LoanListResponse(
        List<LoanResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
