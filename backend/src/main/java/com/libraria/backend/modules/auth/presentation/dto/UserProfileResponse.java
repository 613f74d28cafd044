package com.libraria.backend.modules.auth.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

public record UserProfileResponse(
        UUID id,
        String email,
        String username,
        String firstName,
        String lastName,
        String fullName,
        String phoneNumber,
        String address,
        LocalDate dateOfBirth,
        boolean librarian,
        boolean activeMember,
        OffsetDateTime membershipDate,
        long activeLoansCount,
        boolean canBorrowBooks
) {
}
