package com.libraria.backend.modules.catalog.presentation.dto;

import java.time.OffsetDateTime;

public record BorrowRequest(
        OffsetDateTime dueDate,
        String notes
) {
}
