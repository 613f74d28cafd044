package com.libraria.backend.modules.catalog.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.catalog.domain.BookGenre;
import com.libraria.backend.modules.catalog.domain.BookStatus;

public record BookResponse(
        UUID id,
        String title,
        String author,
        String isbn,
        String publisher,
        LocalDate publicationDate,
        BookGenre genre,
        int pages,
        String language,
        String edition,
        String description,
        String shelfLocation,
        BookStatus status,
        int totalCopies,
        int availableCopies,
        boolean available,
        BigDecimal averageRating,
        int totalRatings,
        int timesBorrowed,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static BookResponse from(Book book) {
        return new BookResponse(
                book.getId(),
                book.getTitle(),
                book.getAuthor(),
                book.getIsbn(),
                book.getPublisher(),
                book.getPublicationDate(),
                book.getGenre(),
                book.getPages(),
                book.getLanguage(),
                book.getEdition(),
                book.getDescription(),
                book.getShelfLocation(),
                book.getStatus(),
                book.getTotalCopies(),
                book.getAvailableCopies(),
                book.isAvailable(),
                book.getAverageRating(),
                book.getTotalRatings(),
                book.getTimesBorrowed(),
                book.getCreatedAt(),
                book.getUpdatedAt()
        );
    }
}
