package com.libraria.backend.modules.loan.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.catalog.domain.BookAvailability;
import com.libraria.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.libraria.backend.modules.loan.domain.Loan;
import com.libraria.backend.modules.loan.domain.LoanStatus;
import com.libraria.backend.modules.loan.domain.ReturnCondition;
import com.libraria.backend.modules.loan.infrastructure.persistence.LoanRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * State machine of a single loan.
 *
 * <pre>
 * BORROWED -> RETURNED | OVERDUE | LOST | DAMAGED
 * OVERDUE  -> RETURNED | LOST | DAMAGED
 * </pre>
 *
 * <p>Methods take entities that the caller has already loaded under the row locks the operation
 * needs. The book copy counters are changed only through {@link BookAvailability}.</p>
 */
@Service
@Transactional
public class LoanLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(LoanLifecycleService.class);

    private final LoanRepository loanRepository;
    private final BookRepository bookRepository;
    private final BorrowingEligibility borrowingEligibility;
    private final LoanPolicy loanPolicy;
    private final Clock clock;

    public LoanLifecycleService(
            LoanRepository loanRepository,
            BookRepository bookRepository,
            BorrowingEligibility borrowingEligibility,
            LoanPolicy loanPolicy,
            Clock clock
    ) {
        this.loanRepository = loanRepository;
        this.bookRepository = bookRepository;
        this.borrowingEligibility = borrowingEligibility;
        this.loanPolicy = loanPolicy;
        this.clock = clock;
    }

    /**
     * Opens a loan. The book row must be locked by the caller.
     */
    public Loan createLoan(LibraryUser borrower, Book book, OffsetDateTime dueDate, LibraryUser issuedBy, String notes) {
        if (!borrowingEligibility.canBorrowBooks(borrower)) {
            throw new ProblemException(
                    HttpStatus.UNPROCESSABLE_ENTITY,
                    ProblemCodes.BORROW_LIMIT_EXCEEDED,
                    "Inactive membership or " + loanPolicy.maxActiveLoans() + " active loans reached"
            );
        }
        if (!book.isAvailable()) {
            throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.BOOK_UNAVAILABLE,
                    "Book is not available for borrowing");
        }
        if (loanRepository.existsByBorrowerIdAndBookIdAndStatus(borrower.getId(), book.getId(), LoanStatus.BORROWED)) {
            throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.DUPLICATE_ACTIVE_LOAN,
                    "You already have an active loan for this book");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime effectiveDueDate = dueDate != null ? dueDate : now.plusDays(loanPolicy.periodDays());
        if (!effectiveDueDate.isAfter(now)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ProblemCodes.INVALID_DUE_DATE,
                    "dueDate must be after the loan date");
        }

        Loan loan = new Loan(borrower, book, now, effectiveDueDate);
        loan.setMaxRenewals(loanPolicy.maxRenewals());
        loan.setIssuedBy(issuedBy);
        loan.setNotes(notes);
        Loan saved = loanRepository.save(loan);

        BookAvailability.applyBorrowDelta(book);
        log.info("Loan {} opened: book={} borrower={} due={} available={}/{}",
                saved.getId(), book.getId(), borrower.getId(), effectiveDueDate,
                book.getAvailableCopies(), book.getTotalCopies());
        return saved;
    }

    public Loan renew(Loan loan, int extraDays) {
        if (extraDays < LoanPolicy.MIN_RENEWAL_DAYS || extraDays > LoanPolicy.MAX_RENEWAL_DAYS) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error",
                    "days must be between " + LoanPolicy.MIN_RENEWAL_DAYS + " and " + LoanPolicy.MAX_RENEWAL_DAYS);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!loan.canRenew(now)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ProblemCodes.NOT_RENEWABLE,
                    "Loan cannot be renewed");
        }
        loan.setDueDate(loan.getDueDate().plusDays(extraDays));
        loan.setRenewalCount(loan.getRenewalCount() + 1);
        log.info("Loan {} renewed by {} days ({}/{})", loan.getId(), extraDays,
                loan.getRenewalCount(), loan.getMaxRenewals());
        return loan;
    }

    /**
     * Closes an open loan. Locks the book row after the loan row; only a GOOD return puts the copy
     * back into circulation.
     */
    public Loan returnLoan(Loan loan, ReturnCondition condition, String notes, LibraryUser returnedTo) {
        if (!loan.getStatus().isOpen()) {
            throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.INVALID_STATE,
                    "Loan is not currently borrowed or overdue");
        }
        ReturnCondition effectiveCondition = condition != null ? condition : ReturnCondition.GOOD;
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (loan.isOverdue(now)) {
            loan.setFineAmount(loan.fineFor(now, loanPolicy.dailyFineRate()));
        }

        loan.setReturnDate(now);
        loan.setStatus(effectiveCondition.resultingStatus());
        loan.setReturnedTo(returnedTo);
        if (notes != null && !notes.isBlank()) {
            loan.setNotes(notes.trim());
        }

        if (loan.getStatus() == LoanStatus.RETURNED) {
            Book book = bookRepository.findByIdForUpdate(loan.getBook().getId())
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.BOOK_NOT_FOUND));
            BookAvailability.applyReturnDelta(book);
        }
        log.info("Loan {} closed as {} fine={}", loan.getId(), loan.getStatus(), loan.getFineAmount());
        return loan;
    }

    public boolean isOverdue(Loan loan) {
        return loan.isOverdue(OffsetDateTime.now(clock));
    }

    public long daysOverdue(Loan loan) {
        return loan.daysOverdue(OffsetDateTime.now(clock));
    }

    /**
     * Recomputes the fine of an overdue loan. A loan that is not overdue keeps its stored amount and
     * {@code 0.00} is returned.
     */
    public BigDecimal calculateFine(Loan loan) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!loan.isOverdue(now)) {
            return BigDecimal.ZERO.setScale(2);
        }
        BigDecimal fine = loan.fineFor(now, loanPolicy.dailyFineRate());
        loan.setFineAmount(fine);
        return fine;
    }

    public Loan payFine(Loan loan) {
        if (loan.getFineAmount() == null || loan.getFineAmount().signum() <= 0) {
            throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.INVALID_STATE, "Loan has no fine");
        }
        if (loan.isFinePaid()) {
            throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.INVALID_STATE, "Fine is already paid");
        }
        loan.setFinePaid(true);
        log.info("Fine {} of loan {} marked paid", loan.getFineAmount(), loan.getId());
        return loan;
    }

    /**
     * Moves every BORROWED loan past its due date to OVERDUE and refreshes its fine.
     *
     * @return number of loans promoted
     */
    public int promoteOverdueLoans() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Loan> candidates = loanRepository.findByStatusAndDueDateBeforeForUpdate(LoanStatus.BORROWED, now);
        for (Loan loan : candidates) {
            loan.setStatus(LoanStatus.OVERDUE);
            loan.setFineAmount(loan.fineFor(now, loanPolicy.dailyFineRate()));
        }
        return candidates.size();
    }
}
