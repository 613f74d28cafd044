package com.libraria.backend.modules.loan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.catalog.domain.BookStatus;
import com.libraria.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.libraria.backend.modules.loan.application.BorrowCoordinator;
import com.libraria.backend.modules.loan.domain.Loan;
import com.libraria.backend.modules.loan.domain.LoanStatus;
import com.libraria.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.libraria.backend.modules.loan.presentation.dto.LoanResponse;
import com.libraria.backend.support.AbstractPostgresIntegrationTest;
import com.libraria.backend.support.IntegrationFixtures;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;

@SpringBootTest
class LoanConcurrencyIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private BorrowCoordinator borrowCoordinator;

    @Autowired
    private BookRepository bookRepository;

    @Autowired
    private LoanRepository loanRepository;

    @Autowired
    private IntegrationFixtures fixtures;

    private ExecutorService executor;

    @AfterEach
    void shutdownExecutor() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("two members racing for the last copy produce exactly one loan")
    void lastCopyIsLentOnce() throws Exception {
        LibraryUser first = fixtures.createUser("racer-one", false);
        LibraryUser second = fixtures.createUser("racer-two", false);
        Book book = fixtures.createBook("9780000000001", 1);

        RaceOutcome outcome = race(
                () -> borrowCoordinator.borrow(first.getId(), book.getId(), null, null),
                () -> borrowCoordinator.borrow(second.getId(), book.getId(), null, null));

        assertThat(outcome.successes()).isEqualTo(1);
        assertThat(outcome.failureCodes()).hasSize(1);
        assertThat(outcome.failureCodes().get(0)).isIn(ProblemCodes.BOOK_UNAVAILABLE, ProblemCodes.CONFLICT);

        Book reloaded = bookRepository.findById(book.getId()).orElseThrow();
        assertThat(reloaded.getAvailableCopies()).isZero();
        assertThat(reloaded.getStatus()).isEqualTo(BookStatus.BORROWED);
        assertThat(reloaded.getTimesBorrowed()).isEqualTo(1);
        assertThat(loanRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("parallel borrows of different books cannot push a member past the loan limit")
    void parallelBorrowsRespectLoanLimit() throws Exception {
        LibraryUser member = fixtures.createUser("busy-reader", false);
        for (int i = 0; i < 4; i++) {
            Book held = fixtures.createBook("978000000010" + i, 1);
            borrowCoordinator.borrow(member.getId(), held.getId(), null, null);
        }
        Book left = fixtures.createBook("9780000000110", 1);
        Book right = fixtures.createBook("9780000000111", 1);

        RaceOutcome outcome = race(
                () -> borrowCoordinator.borrow(member.getId(), left.getId(), null, null),
                () -> borrowCoordinator.borrow(member.getId(), right.getId(), null, null));

        assertThat(outcome.successes()).isEqualTo(1);
        assertThat(outcome.failureCodes()).hasSize(1);
        assertThat(outcome.failureCodes().get(0)).isIn(ProblemCodes.BORROW_LIMIT_EXCEEDED, ProblemCodes.CONFLICT);
        assertThat(loanRepository.countByBorrowerIdAndStatus(member.getId(), LoanStatus.BORROWED)).isEqualTo(5);
    }

    @Test
    void borrowingSameBookTwiceIsRejected() {
        LibraryUser member = fixtures.createUser("repeat-reader", false);
        Book book = fixtures.createBook("9780000000002", 3);

        borrowCoordinator.borrow(member.getId(), book.getId(), null, null);

        assertThatThrownBy(() -> borrowCoordinator.borrow(member.getId(), book.getId(), null, null))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo(ProblemCodes.DUPLICATE_ACTIVE_LOAN);
        assertThat(bookRepository.findById(book.getId()).orElseThrow().getAvailableCopies()).isEqualTo(2);
    }

    @Test
    void databaseRejectsSecondActiveLoanForSameMemberAndBook() {
        LibraryUser member = fixtures.createUser("index-reader", false);
        Book book = fixtures.createBook("9780000000003", 2);
        OffsetDateTime now = OffsetDateTime.now();

        loanRepository.saveAndFlush(new Loan(member, book, now, now.plusDays(14)));
        Loan duplicate = new Loan(member, book, now, now.plusDays(7));

        assertThatThrownBy(() -> loanRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void closedLoanDoesNotBlockNewActiveLoan() {
        LibraryUser member = fixtures.createUser("return-reader", false);
        Book book = fixtures.createBook("9780000000004", 2);
        OffsetDateTime now = OffsetDateTime.now();

        Loan returned = new Loan(member, book, now.minusDays(20), now.minusDays(6));
        returned.setStatus(LoanStatus.RETURNED);
        returned.setReturnDate(now.minusDays(7));
        loanRepository.saveAndFlush(returned);

        loanRepository.saveAndFlush(new Loan(member, book, now, now.plusDays(14)));

        assertThat(loanRepository.countByBorrowerIdAndStatus(member.getId(), LoanStatus.BORROWED)).isEqualTo(1);
    }

    private RaceOutcome race(Callable<LoanResponse> left, Callable<LoanResponse> right) throws Exception {
        executor = Executors.newFixedThreadPool(2);
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LoanResponse>> futures = new ArrayList<>();
        for (Callable<LoanResponse> attempt : List.of(left, right)) {
            futures.add(executor.submit(() -> {
                ready.countDown();
                start.await(5, TimeUnit.SECONDS);
                return attempt.call();
            }));
        }
        assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
        start.countDown();

        int successes = 0;
        List<String> failureCodes = new ArrayList<>();
        for (Future<LoanResponse> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
                successes++;
            } catch (ExecutionException ex) {
                assertThat(ex.getCause()).isInstanceOf(ProblemException.class);
                failureCodes.add(((ProblemException) ex.getCause()).getCode());
            }
        }
        return new RaceOutcome(successes, failureCodes);
    }

    private record RaceOutcome(int successes, List<String> failureCodes) {
    }
}
