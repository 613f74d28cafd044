package com.libraria.backend.modules.rating.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.libraria.backend.modules.rating.domain.BookRating;

public record RatingResponse(
        UUID id,
        UUID userId,
        String username,
        UUID bookId,
        String bookTitle,
        int rating,
        String review,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static RatingResponse from(BookRating rating) {
        return new RatingResponse(
                rating.getId(),
                rating.getUser().getId(),
                rating.getUser().getUsername(),
                rating.getBook().getId(),
                rating.getBook().getTitle(),
                rating.getRating(),
                rating.getReview(),
                rating.getCreatedAt(),
                rating.getUpdatedAt()
        );
    }
}
