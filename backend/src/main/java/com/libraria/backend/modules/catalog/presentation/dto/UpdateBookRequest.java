package com.libraria.backend.modules.catalog.presentation.dto;

import java.time.LocalDate;

import com.libraria.backend.modules.catalog.domain.BookGenre;
import com.libraria.backend.modules.catalog.domain.BookStatus;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update. Copy counters change only through {@code totalCopies}; {@code availableCopies}
 * is derived from loans and is not editable.
 */
public record UpdateBookRequest(
        @Size(min = 1, max = 200) String title,
        @Size(min = 1, max = 200) String author,
        @Pattern(regexp = "\\d{10}|\\d{13}", message = "isbn must have 10 or 13 digits") String isbn,
        @Size(min = 1, max = 200) String publisher,
        LocalDate publicationDate,
        BookGenre genre,
        @Min(1) Integer pages,
        @Size(min = 1, max = 50) String language,
        @Size(max = 50) String edition,
        String description,
        @Size(max = 50) String shelfLocation,
        BookStatus status,
        @Min(1) Integer totalCopies
) {
}
