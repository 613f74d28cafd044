package com.libraria.backend.modules.rating.application;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.rating.infrastructure.persistence.BookRatingRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps {@code averageRating} and {@code totalRatings} of a book in line with its rating rows.
 */
@Component
@Transactional
public class RatingAggregator {

    private final BookRatingRepository ratingRepository;

    public RatingAggregator(BookRatingRepository ratingRepository) {
        this.ratingRepository = ratingRepository;
    }

    /**
     * Must run after the rating change in the same transaction, with the book row locked. Pending
     * rating writes are flushed so the aggregate reads the post-change set.
     */
    public void recomputeAverage(Book book) {
        ratingRepository.flush();
        long count = ratingRepository.countByBookId(book.getId());
        if (count == 0) {
            book.setAverageRating(BigDecimal.ZERO.setScale(2));
            book.setTotalRatings(0);
            return;
        }
        long sum = ratingRepository.sumRatingsByBookId(book.getId());
        book.setAverageRating(BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP));
        book.setTotalRatings(Math.toIntExact(count));
    }
}
