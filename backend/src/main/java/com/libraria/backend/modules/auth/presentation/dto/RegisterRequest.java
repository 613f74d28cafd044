package com.libraria.backend.modules.auth.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank @Email @Size(max = 254) String email,
        @NotBlank @Size(max = 150) String username,
        @NotBlank @Size(min = 8, max = 128) String password,
        @NotBlank String passwordConfirm,
        @NotBlank @Size(max = 150) String firstName,
        @NotBlank @Size(max = 150) String lastName,
        @Size(max = 15) String phoneNumber,
        String address,
        @Past LocalDate dateOfBirth
) {
}
