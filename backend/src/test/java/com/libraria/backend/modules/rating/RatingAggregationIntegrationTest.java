package com.libraria.backend.modules.rating;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;

import com.libraria.backend.global.security.JwtAuthenticationPrincipal;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.libraria.backend.modules.rating.application.BookRatingService;
import com.libraria.backend.modules.rating.presentation.dto.RateBookRequest;
import com.libraria.backend.modules.rating.presentation.dto.RateBookResponse;
import com.libraria.backend.support.AbstractPostgresIntegrationTest;
import com.libraria.backend.support.IntegrationFixtures;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class RatingAggregationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private BookRatingService bookRatingService;

    @Autowired
    private BookRepository bookRepository;

    @Autowired
    private IntegrationFixtures fixtures;

    @Test
    void averageFollowsInsertAndDelete() {
        Book book = fixtures.createBook("9780000000010", 1);
        LibraryUser alice = fixtures.createUser("alice", false);
        LibraryUser bob = fixtures.createUser("bob", false);
        LibraryUser carol = fixtures.createUser("carol", false);

        bookRatingService.rate(alice.getId(), book.getId(), new RateBookRequest(5, "loved it"));
        RateBookResponse bobs = bookRatingService.rate(bob.getId(), book.getId(), new RateBookRequest(3, null));
        RateBookResponse last = bookRatingService.rate(carol.getId(), book.getId(), new RateBookRequest(4, null));

        assertThat(last.created()).isTrue();
        assertThat(last.bookAverageRating()).isEqualByComparingTo("4.00");
        assertThat(last.bookTotalRatings()).isEqualTo(3);

        JwtAuthenticationPrincipal bobPrincipal = new JwtAuthenticationPrincipal(bob.getId(), bob.getEmail(), List.of("MEMBER"));
        bookRatingService.deleteRating(bobs.rating().id(), bobPrincipal);

        Book reloaded = bookRepository.findById(book.getId()).orElseThrow();
        assertThat(reloaded.getAverageRating()).isEqualByComparingTo(new BigDecimal("4.50"));
        assertThat(reloaded.getTotalRatings()).isEqualTo(2);
    }

    @Test
    void reratingUpdatesExistingRow() {
        Book book = fixtures.createBook("9780000000011", 1);
        LibraryUser dave = fixtures.createUser("dave", false);

        bookRatingService.rate(dave.getId(), book.getId(), new RateBookRequest(2, null));
        RateBookResponse second = bookRatingService.rate(dave.getId(), book.getId(), new RateBookRequest(5, "better on reread"));

        assertThat(second.created()).isFalse();
        assertThat(second.bookTotalRatings()).isEqualTo(1);
        assertThat(second.bookAverageRating()).isEqualByComparingTo("5.00");
    }
}
