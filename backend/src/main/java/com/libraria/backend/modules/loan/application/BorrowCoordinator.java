package com.libraria.backend.modules.loan.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.global.error.RetryableProblemException;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.libraria.backend.modules.loan.domain.Loan;
import com.libraria.backend.modules.loan.presentation.dto.LoanResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Serializes borrow attempts on one book through its row lock.
 *
 * <p>Each attempt runs in its own transaction: {@code SELECT ... FOR UPDATE} on the borrower, then
 * on the book, then {@link LoanLifecycleService#createLoan}. A second borrower of the last copy
 * blocks on the book lock and then sees no copy left. Parallel borrows by one member queue on the
 * member row, so the active-loan limit is checked against committed loans. Lock timeouts roll the attempt back and are retried a bounded number
 * of times before surfacing as a retryable {@code CONFLICT}.</p>
 */
@Service
public class BorrowCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BorrowCoordinator.class);
    static final int RETRY_AFTER_SECONDS = 1;

    private final TransactionOperations transactionOperations;
    private final BookRepository bookRepository;
    private final LibraryUserRepository userRepository;
    private final LoanLifecycleService loanLifecycleService;
    private final LoanPolicy loanPolicy;
    private final Clock clock;

    public BorrowCoordinator(
            TransactionOperations transactionOperations,
            BookRepository bookRepository,
            LibraryUserRepository userRepository,
            LoanLifecycleService loanLifecycleService,
            LoanPolicy loanPolicy,
            Clock clock
    ) {
        this.transactionOperations = transactionOperations;
        this.bookRepository = bookRepository;
        this.userRepository = userRepository;
        this.loanLifecycleService = loanLifecycleService;
        this.loanPolicy = loanPolicy;
        this.clock = clock;
    }

    public LoanResponse borrow(UUID userId, UUID bookId, OffsetDateTime dueDate, String notes) {
        int maxAttempts = loanPolicy.borrowMaxAttempts();
        PessimisticLockingFailureException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionOperations.execute(status -> borrowOnce(userId, bookId, dueDate, notes));
            } catch (PessimisticLockingFailureException ex) {
                lastFailure = ex;
                log.warn("Borrow of book {} by user {} hit a lock conflict (attempt {}/{})",
                        bookId, userId, attempt, maxAttempts);
            }
        }
        log.warn("Borrow of book {} by user {} gave up after {} attempts", bookId, userId, maxAttempts, lastFailure);
        throw new RetryableProblemException(HttpStatus.CONFLICT, ProblemCodes.CONFLICT,
                "The book is busy, retry the request", RETRY_AFTER_SECONDS);
    }

    private LoanResponse borrowOnce(UUID userId, UUID bookId, OffsetDateTime dueDate, String notes) {
        LibraryUser borrower = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.USER_NOT_FOUND));
        Book book = bookRepository.findByIdForUpdate(bookId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.BOOK_NOT_FOUND));
        LibraryUser issuedBy = borrower.isLibrarian() ? borrower : null;
        Loan loan = loanLifecycleService.createLoan(borrower, book, dueDate, issuedBy, notes);
        return LoanResponse.from(loan, OffsetDateTime.now(clock));
    }
}
