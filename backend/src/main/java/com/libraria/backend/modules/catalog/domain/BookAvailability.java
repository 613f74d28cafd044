package com.libraria.backend.modules.catalog.domain;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;

/**
 * Copy-count and status transitions of a {@link Book}.
 *
 * <p>Every method mutates the given entity in memory only. Callers hold the book row lock and
 * persist the result inside their own transaction. After each call
 * {@code 0 <= availableCopies <= totalCopies} holds.</p>
 */
public final class BookAvailability {

    private static final Logger log = LoggerFactory.getLogger(BookAvailability.class);

    private BookAvailability() {
    }

    public static void applyBorrowDelta(Book book) {
        if (book.getAvailableCopies() <= 0) {
            throw new ProblemException(
                    HttpStatus.UNPROCESSABLE_ENTITY,
                    ProblemCodes.CAPACITY_VIOLATION,
                    "No available copies left for book " + book.getId()
            );
        }
        book.setAvailableCopies(book.getAvailableCopies() - 1);
        book.setTimesBorrowed(book.getTimesBorrowed() + 1);
        reconcileStatus(book);
    }

    public static void applyReturnDelta(Book book) {
        if (book.getAvailableCopies() >= book.getTotalCopies()) {
            log.warn("Return on book {} with all {} copies already on the shelf; available count left at total",
                    book.getId(), book.getTotalCopies());
        } else {
            book.setAvailableCopies(book.getAvailableCopies() + 1);
        }
        reconcileStatus(book);
    }

    /**
     * Shifts the available count by the same delta as the total, clamped to {@code [0, newTotal]}.
     */
    public static void adjustForCapacityChange(Book book, int oldTotal, int newTotal) {
        if (newTotal < 1) {
            throw new ProblemException(
                    HttpStatus.UNPROCESSABLE_ENTITY,
                    ProblemCodes.CAPACITY_VIOLATION,
                    "totalCopies must be at least 1"
            );
        }
        int shifted = book.getAvailableCopies() + (newTotal - oldTotal);
        book.setTotalCopies(newTotal);
        book.setAvailableCopies(Math.max(0, Math.min(shifted, newTotal)));
        reconcileStatus(book);
    }

    public static void reconcileStatus(Book book) {
        if (book.getAvailableCopies() == 0 && book.getStatus() == BookStatus.AVAILABLE) {
            book.setStatus(BookStatus.BORROWED);
        } else if (book.getAvailableCopies() > 0 && book.getStatus() == BookStatus.BORROWED) {
            book.setStatus(BookStatus.AVAILABLE);
        }
    }
}
