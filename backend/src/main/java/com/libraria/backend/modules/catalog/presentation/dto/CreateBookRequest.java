package com.libraria.backend.modules.catalog.presentation.dto;

import java.time.LocalDate;

import com.libraria.backend.modules.catalog.domain.BookGenre;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * {@code availableCopies} defaults to {@code totalCopies} when omitted.
 */
public record CreateBookRequest(
        @NotBlank @Size(max = 200) String title,
        @NotBlank @Size(max = 200) String author,
        @NotBlank @Pattern(regexp = "\\d{10}|\\d{13}", message = "isbn must have 10 or 13 digits") String isbn,
        @NotBlank @Size(max = 200) String publisher,
        @NotNull LocalDate publicationDate,
        @NotNull BookGenre genre,
        @NotNull @Min(1) Integer pages,
        @Size(max = 50) String language,
        @Size(max = 50) String edition,
        String description,
        @Size(max = 50) String shelfLocation,
        @NotNull @Min(1) Integer totalCopies,
        @Min(0) Integer availableCopies
) {
}
