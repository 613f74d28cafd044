package com.libraria.backend.modules.auth.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateProfileRequest(
        @Size(max = 150) String firstName,
        @Size(max = 150) String lastName,
        @Size(max = 15) String phoneNumber,
        String address,
        @Past LocalDate dateOfBirth
) {
}
