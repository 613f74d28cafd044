package com.libraria.backend.modules.rating.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;

import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.rating.infrastructure.persistence.BookRatingRepository;
import com.libraria.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RatingAggregatorTest {

    @Mock
    private BookRatingRepository ratingRepository;

    private RatingAggregator aggregator;
    private Book book;

    @BeforeEach
    void setUp() {
        aggregator = new RatingAggregator(ratingRepository);
        book = TestEntities.book(1, 1);
    }

    @Test
    @DisplayName("ratings 5, 3 and 4 average to 4.00")
    void averagesThreeRatings() {
        when(ratingRepository.countByBookId(book.getId())).thenReturn(3L);
        when(ratingRepository.sumRatingsByBookId(book.getId())).thenReturn(12L);

        aggregator.recomputeAverage(book);

        assertThat(book.getAverageRating()).isEqualTo(new BigDecimal("4.00"));
        assertThat(book.getTotalRatings()).isEqualTo(3);
    }

    @Test
    @DisplayName("after removing the 3 the remaining 5 and 4 average to 4.50")
    void recomputesAfterDelete() {
        when(ratingRepository.countByBookId(book.getId())).thenReturn(2L);
        when(ratingRepository.sumRatingsByBookId(book.getId())).thenReturn(9L);

        aggregator.recomputeAverage(book);

        assertThat(book.getAverageRating()).isEqualTo(new BigDecimal("4.50"));
        assertThat(book.getTotalRatings()).isEqualTo(2);
    }

    @Test
    void roundsHalfUpToTwoDecimals() {
        when(ratingRepository.countByBookId(book.getId())).thenReturn(3L);
        when(ratingRepository.sumRatingsByBookId(book.getId())).thenReturn(14L);

        aggregator.recomputeAverage(book);

        assertThat(book.getAverageRating()).isEqualTo(new BigDecimal("4.67"));
    }

    @Test
    void noRatingsResetsToZero() {
        book.setAverageRating(new BigDecimal("3.00"));
        book.setTotalRatings(1);
        when(ratingRepository.countByBookId(book.getId())).thenReturn(0L);

        aggregator.recomputeAverage(book);

        assertThat(book.getAverageRating()).isEqualTo(new BigDecimal("0.00"));
        assertThat(book.getTotalRatings()).isZero();
    }

    @Test
    void flushesPendingWritesBeforeReading() {
        when(ratingRepository.countByBookId(book.getId())).thenReturn(1L);
        when(ratingRepository.sumRatingsByBookId(book.getId())).thenReturn(5L);

        aggregator.recomputeAverage(book);

        InOrder order = inOrder(ratingRepository);
        order.verify(ratingRepository).flush();
        order.verify(ratingRepository).countByBookId(book.getId());
    }
}
