package com.libraria.backend.modules.catalog.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BookAvailabilityTest {

    @Test
    @DisplayName("borrow decrements available copies and counts the borrow")
    void borrowDelta() {
        Book book = TestEntities.book(3, 3);

        BookAvailability.applyBorrowDelta(book);

        assertThat(book.getAvailableCopies()).isEqualTo(2);
        assertThat(book.getTimesBorrowed()).isEqualTo(1);
        assertThat(book.getStatus()).isEqualTo(BookStatus.AVAILABLE);
    }

    @Test
    @DisplayName("borrowing the last copy flips the status to BORROWED and return flips it back")
    void lastCopyTogglesStatus() {
        Book book = TestEntities.book(1, 1);

        BookAvailability.applyBorrowDelta(book);
        assertThat(book.getAvailableCopies()).isZero();
        assertThat(book.getStatus()).isEqualTo(BookStatus.BORROWED);
        assertThat(book.isAvailable()).isFalse();

        BookAvailability.applyReturnDelta(book);
        assertThat(book.getAvailableCopies()).isEqualTo(1);
        assertThat(book.getStatus()).isEqualTo(BookStatus.AVAILABLE);
        assertThat(book.getTimesBorrowed()).isEqualTo(1);
    }

    @Test
    void borrowWithoutCopiesIsCapacityViolation() {
        Book book = TestEntities.book(2, 0);

        assertThatThrownBy(() -> BookAvailability.applyBorrowDelta(book))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.CAPACITY_VIOLATION);
        assertThat(book.getAvailableCopies()).isZero();
        assertThat(book.getTimesBorrowed()).isZero();
    }

    @Test
    @DisplayName("return never pushes available copies above the total")
    void returnIsCappedAtTotal() {
        Book book = TestEntities.book(2, 2);

        BookAvailability.applyReturnDelta(book);

        assertThat(book.getAvailableCopies()).isEqualTo(2);
    }

    @Test
    void shrinkingCapacityCapsAvailableAtNewTotal() {
        Book book = TestEntities.book(5, 5);

        BookAvailability.adjustForCapacityChange(book, 5, 3);

        assertThat(book.getTotalCopies()).isEqualTo(3);
        assertThat(book.getAvailableCopies()).isEqualTo(3);
    }

    @Test
    void growingCapacityPreservesDelta() {
        Book book = TestEntities.book(5, 2);

        BookAvailability.adjustForCapacityChange(book, 5, 10);

        assertThat(book.getTotalCopies()).isEqualTo(10);
        assertThat(book.getAvailableCopies()).isEqualTo(7);
    }

    @Test
    void shrinkingBelowLoanedCopiesClampsAtZero() {
        Book book = TestEntities.book(5, 1);

        BookAvailability.adjustForCapacityChange(book, 5, 2);

        assertThat(book.getAvailableCopies()).isZero();
        assertThat(book.getStatus()).isEqualTo(BookStatus.BORROWED);
    }

    @Test
    void capacityBelowOneIsRejected() {
        Book book = TestEntities.book(2, 2);

        assertThatThrownBy(() -> BookAvailability.adjustForCapacityChange(book, 2, 0))
                .isInstanceOf(ProblemException.class)
                .hasMessageContaining(ProblemCodes.CAPACITY_VIOLATION);
        assertThat(book.getTotalCopies()).isEqualTo(2);
    }

    @Test
    @DisplayName("librarian-set statuses survive counter changes")
    void reconcileKeepsManualStatus() {
        Book book = TestEntities.book(2, 1);
        book.setStatus(BookStatus.MAINTENANCE);

        BookAvailability.applyReturnDelta(book);
        assertThat(book.getStatus()).isEqualTo(BookStatus.MAINTENANCE);

        book.setStatus(BookStatus.LOST);
        BookAvailability.adjustForCapacityChange(book, 2, 1);
        assertThat(book.getStatus()).isEqualTo(BookStatus.LOST);
        assertThat(book.isAvailable()).isFalse();
    }
}
