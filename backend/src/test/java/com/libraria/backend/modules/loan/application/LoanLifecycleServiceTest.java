package com.libraria.backend.modules.loan.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.catalog.domain.BookStatus;
import com.libraria.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.libraria.backend.modules.loan.domain.Loan;
import com.libraria.backend.modules.loan.domain.LoanStatus;
import com.libraria.backend.modules.loan.domain.ReturnCondition;
import com.libraria.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.libraria.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LoanLifecycleServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private LoanRepository loanRepository;

    @Mock
    private BookRepository bookRepository;

    private LoanLifecycleService service;
    private LibraryUser member;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        LoanPolicy policy = LoanPolicy.defaults();
        BorrowingEligibility eligibility = new BorrowingEligibility(loanRepository, policy);
        service = new LoanLifecycleService(loanRepository, bookRepository, eligibility, policy, clock);
        member = TestEntities.member("ana");

        lenient().when(loanRepository.save(any(Loan.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("createLoan opens a BORROWED loan due in 14 days and takes one copy")
    void createLoanDefaultsDueDateAndTakesCopy() {
        Book book = TestEntities.book(2, 2);

        Loan loan = service.createLoan(member, book, null, null, null);

        assertThat(loan.getStatus()).isEqualTo(LoanStatus.BORROWED);
        assertThat(loan.getLoanDate()).isEqualTo(NOW);
        assertThat(loan.getDueDate()).isEqualTo(NOW.plusDays(14));
        assertThat(loan.getMaxRenewals()).isEqualTo(2);
        assertThat(book.getAvailableCopies()).isEqualTo(1);
        assertThat(book.getTimesBorrowed()).isEqualTo(1);
        verify(loanRepository).save(loan);
    }

    @Test
    void createLoanRejectsMemberAtLimit() {
        Book book = TestEntities.book(2, 2);
        when(loanRepository.countByBorrowerIdAndStatus(member.getId(), LoanStatus.BORROWED)).thenReturn(5L);

        assertThatThrownBy(() -> service.createLoan(member, book, null, null, null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.BORROW_LIMIT_EXCEEDED);
        assertThat(book.getAvailableCopies()).isEqualTo(2);
        verify(loanRepository, never()).save(any());
    }

    @Test
    void fourActiveLoansStillAllowBorrowing() {
        Book book = TestEntities.book(1, 1);
        when(loanRepository.countByBorrowerIdAndStatus(member.getId(), LoanStatus.BORROWED)).thenReturn(4L);

        Loan loan = service.createLoan(member, book, null, null, null);

        assertThat(loan.getStatus()).isEqualTo(LoanStatus.BORROWED);
    }

    @Test
    void createLoanRejectsInactiveMember() {
        member.setActiveMember(false);

        assertThatThrownBy(() -> service.createLoan(member, TestEntities.book(1, 1), null, null, null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.BORROW_LIMIT_EXCEEDED);
    }

    @Test
    void createLoanRejectsBookWithoutCopies() {
        Book book = TestEntities.book(1, 0);

        assertThatThrownBy(() -> service.createLoan(member, book, null, null, null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.BOOK_UNAVAILABLE);
    }

    @Test
    void createLoanRejectsBookUnderMaintenance() {
        Book book = TestEntities.book(3, 3);
        book.setStatus(BookStatus.MAINTENANCE);

        assertThatThrownBy(() -> service.createLoan(member, book, null, null, null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.BOOK_UNAVAILABLE);
    }

    @Test
    void createLoanRejectsSecondActiveLoanForSameBook() {
        Book book = TestEntities.book(3, 2);
        when(loanRepository.existsByBorrowerIdAndBookIdAndStatus(member.getId(), book.getId(), LoanStatus.BORROWED))
                .thenReturn(true);

        assertThatThrownBy(() -> service.createLoan(member, book, null, null, null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.DUPLICATE_ACTIVE_LOAN);
        assertThat(book.getAvailableCopies()).isEqualTo(2);
    }

    @Test
    void createLoanRejectsDueDateInThePast() {
        Book book = TestEntities.book(1, 1);

        assertThatThrownBy(() -> service.createLoan(member, book, NOW.minusDays(1), null, null))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.INVALID_DUE_DATE);
        assertThat(book.getAvailableCopies()).isEqualTo(1);
    }

    @Test
    void renewExtendsDueDateAndCountsRenewal() {
        Loan loan = TestEntities.loan(member, TestEntities.book(1, 0), NOW.minusDays(3), NOW.plusDays(11));

        service.renew(loan, 14);

        assertThat(loan.getDueDate()).isEqualTo(NOW.plusDays(25));
        assertThat(loan.getRenewalCount()).isEqualTo(1);
    }

    @Test
    void renewAtMaxRenewalsIsNotRenewable() {
        Loan loan = TestEntities.loan(member, TestEntities.book(1, 0), NOW.minusDays(3), NOW.plusDays(11));
        loan.setRenewalCount(2);

        assertThatThrownBy(() -> service.renew(loan, 14))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.NOT_RENEWABLE);
        assertThat(loan.getDueDate()).isEqualTo(NOW.plusDays(11));
    }

    @Test
    void renewOverdueLoanIsNotRenewable() {
        Loan loan = TestEntities.loan(member, TestEntities.book(1, 0), NOW.minusDays(20), NOW.minusDays(6));

        assertThatThrownBy(() -> service.renew(loan, 7))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.NOT_RENEWABLE);
    }

    @Test
    void renewRejectsOutOfRangeDays() {
        Loan loan = TestEntities.loan(member, TestEntities.book(1, 0), NOW.minusDays(3), NOW.plusDays(11));

        assertThatThrownBy(() -> service.renew(loan, 31)).isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> service.renew(loan, 0)).isInstanceOf(ProblemException.class);
        assertThat(loan.getRenewalCount()).isZero();
    }

    @Test
    @DisplayName("a GOOD return closes the loan and puts the copy back")
    void returnGoodRestoresCopy() {
        Book book = TestEntities.book(1, 0);
        Loan loan = TestEntities.loan(member, book, NOW.minusDays(3), NOW.plusDays(11));
        LibraryUser librarian = TestEntities.librarian("lib");
        when(bookRepository.findByIdForUpdate(book.getId())).thenReturn(Optional.of(book));

        service.returnLoan(loan, ReturnCondition.GOOD, "  fine shape ", librarian);

        assertThat(loan.getStatus()).isEqualTo(LoanStatus.RETURNED);
        assertThat(loan.getReturnDate()).isEqualTo(NOW);
        assertThat(loan.getReturnedTo()).isSameAs(librarian);
        assertThat(loan.getNotes()).isEqualTo("fine shape");
        assertThat(loan.getFineAmount()).isEqualByComparingTo("0.00");
        assertThat(book.getAvailableCopies()).isEqualTo(1);
        assertThat(book.getStatus()).isEqualTo(BookStatus.AVAILABLE);
    }

    @Test
    void returnLostKeepsCopyOutOfCirculation() {
        Book book = TestEntities.book(2, 1);
        Loan loan = TestEntities.loan(member, book, NOW.minusDays(3), NOW.plusDays(11));

        service.returnLoan(loan, ReturnCondition.LOST, null, member);

        assertThat(loan.getStatus()).isEqualTo(LoanStatus.LOST);
        assertThat(book.getAvailableCopies()).isEqualTo(1);
        verify(bookRepository, never()).findByIdForUpdate(any());
    }

    @Test
    void returnDamagedKeepsCopyOutOfCirculation() {
        Book book = TestEntities.book(2, 1);
        Loan loan = TestEntities.loan(member, book, NOW.minusDays(3), NOW.plusDays(11));

        service.returnLoan(loan, ReturnCondition.DAMAGED, null, member);

        assertThat(loan.getStatus()).isEqualTo(LoanStatus.DAMAGED);
        assertThat(book.getAvailableCopies()).isEqualTo(1);
    }

    @Test
    void returnOfOverdueLoanChargesFineFirst() {
        Book book = TestEntities.book(1, 0);
        Loan loan = TestEntities.loan(member, book, NOW.minusDays(19), NOW.minusDays(5));
        when(bookRepository.findByIdForUpdate(book.getId())).thenReturn(Optional.of(book));

        service.returnLoan(loan, null, null, member);

        assertThat(loan.getStatus()).isEqualTo(LoanStatus.RETURNED);
        assertThat(loan.getFineAmount()).isEqualByComparingTo("5.00");
    }

    @Test
    void returnOfClosedLoanIsInvalidState() {
        Loan loan = TestEntities.loan(member, TestEntities.book(1, 1), NOW.minusDays(3), NOW.plusDays(11));
        loan.setStatus(LoanStatus.RETURNED);

        assertThatThrownBy(() -> service.returnLoan(loan, ReturnCondition.GOOD, null, member))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.INVALID_STATE);
    }

    @Test
    @DisplayName("fine for 5 days overdue at 1.00/day is 5.00")
    void calculateFineForOverdueLoan() {
        Loan loan = TestEntities.loan(member, TestEntities.book(1, 0), NOW.minusDays(19), NOW.minusDays(5));

        BigDecimal fine = service.calculateFine(loan);

        assertThat(fine).isEqualByComparingTo("5.00");
        assertThat(loan.getFineAmount()).isEqualByComparingTo("5.00");
        assertThat(service.daysOverdue(loan)).isEqualTo(5);
        assertThat(service.isOverdue(loan)).isTrue();
    }

    @Test
    void calculateFineOnCurrentLoanLeavesAmountUntouched() {
        Loan loan = TestEntities.loan(member, TestEntities.book(1, 0), NOW.minusDays(3), NOW.plusDays(11));
        loan.setFineAmount(new BigDecimal("2.50"));

        BigDecimal fine = service.calculateFine(loan);

        assertThat(fine).isEqualByComparingTo("0.00");
        assertThat(fine.scale()).isEqualTo(2);
        assertThat(loan.getFineAmount()).isEqualByComparingTo("2.50");
    }

    @Test
    void payFineMarksItPaid() {
        Loan loan = TestEntities.loan(member, TestEntities.book(1, 0), NOW.minusDays(19), NOW.minusDays(5));
        loan.setFineAmount(new BigDecimal("5.00"));

        service.payFine(loan);

        assertThat(loan.isFinePaid()).isTrue();
        assertThatThrownBy(() -> service.payFine(loan))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.INVALID_STATE);
    }

    @Test
    void payFineWithoutFineIsInvalidState() {
        Loan loan = TestEntities.loan(member, TestEntities.book(1, 0), NOW.minusDays(3), NOW.plusDays(11));

        assertThatThrownBy(() -> service.payFine(loan))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo(ProblemCodes.INVALID_STATE);
    }

    @Test
    void promoteOverdueLoansMarksAndFinesEachLoan() {
        Loan late = TestEntities.loan(member, TestEntities.book(1, 0), NOW.minusDays(17), NOW.minusDays(3));
        Loan later = TestEntities.loan(TestEntities.member("bo"), TestEntities.book(1, 0), NOW.minusDays(24), NOW.minusDays(10));
        when(loanRepository.findByStatusAndDueDateBeforeForUpdate(eq(LoanStatus.BORROWED), eq(NOW)))
                .thenReturn(List.of(late, later));

        int promoted = service.promoteOverdueLoans();

        assertThat(promoted).isEqualTo(2);
        assertThat(late.getStatus()).isEqualTo(LoanStatus.OVERDUE);
        assertThat(late.getFineAmount()).isEqualByComparingTo("3.00");
        assertThat(later.getFineAmount()).isEqualByComparingTo("10.00");
    }

    @Test
    void promoteOverdueLoansWithNothingDueReturnsZero() {
        when(loanRepository.findByStatusAndDueDateBeforeForUpdate(LoanStatus.BORROWED, NOW)).thenReturn(List.of());

        assertThat(service.promoteOverdueLoans()).isZero();
    }
}
