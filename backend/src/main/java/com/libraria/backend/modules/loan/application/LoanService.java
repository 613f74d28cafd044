package com.libraria.backend.modules.loan.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.global.security.JwtAuthenticationPrincipal;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.libraria.backend.modules.loan.domain.Loan;
import com.libraria.backend.modules.loan.domain.LoanStatus;
import com.libraria.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.libraria.backend.modules.loan.presentation.dto.FineResponse;
import com.libraria.backend.modules.loan.presentation.dto.LoanListResponse;
import com.libraria.backend.modules.loan.presentation.dto.LoanResponse;
import com.libraria.backend.modules.loan.presentation.dto.LoanStatisticsResponse;
import com.libraria.backend.modules.loan.presentation.dto.RenewLoanRequest;
import com.libraria.backend.modules.loan.presentation.dto.ReturnLoanRequest;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Request-facing loan operations: loads and locks rows, applies the owner-or-librarian rule and
 * maps results. State changes are delegated to {@link LoanLifecycleService}.
 */
@Service
@Transactional
public class LoanService {

    private static final int MAX_PAGE_SIZE = 100;
    private static final Set<LoanStatus> ALL_STATUSES = EnumSet.allOf(LoanStatus.class);

    private final LoanRepository loanRepository;
    private final LibraryUserRepository userRepository;
    private final LoanLifecycleService loanLifecycleService;
    private final Clock clock;

    public LoanService(
            LoanRepository loanRepository,
            LibraryUserRepository userRepository,
            LoanLifecycleService loanLifecycleService,
            Clock clock
    ) {
        this.loanRepository = loanRepository;
        this.userRepository = userRepository;
        this.loanLifecycleService = loanLifecycleService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public LoanListResponse listLoans(JwtAuthenticationPrincipal principal, LoanStatus status, int page, int size) {
        UUID borrowerId = principal.isLibrarian() ? null : principal.userId();
        Set<LoanStatus> statuses = status != null ? EnumSet.of(status) : ALL_STATUSES;
        return page(borrowerId, statuses, page, size);
    }

    @Transactional(readOnly = true)
    public LoanListResponse history(JwtAuthenticationPrincipal principal, int page, int size) {
        return page(principal.userId(), ALL_STATUSES, page, size);
    }

    @Transactional(readOnly = true)
    public LoanListResponse currentLoans(JwtAuthenticationPrincipal principal, int page, int size) {
        return page(principal.userId(), EnumSet.of(LoanStatus.BORROWED), page, size);
    }

    /**
     * Promotes due loans first so the listing reflects the current time.
     */
    public LoanListResponse overdueLoans(JwtAuthenticationPrincipal principal, int page, int size) {
        loanLifecycleService.promoteOverdueLoans();
        UUID borrowerId = principal.isLibrarian() ? null : principal.userId();
        return page(borrowerId, EnumSet.of(LoanStatus.OVERDUE), page, size);
    }

    @Transactional(readOnly = true)
    public LoanResponse getLoan(UUID loanId, JwtAuthenticationPrincipal principal) {
        Loan loan = loanRepository.findById(loanId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.LOAN_NOT_FOUND));
        requireOwnerOrLibrarian(loan, principal);
        return LoanResponse.from(loan, now());
    }

    public LoanResponse renew(UUID loanId, RenewLoanRequest request, JwtAuthenticationPrincipal principal) {
        Loan loan = lockLoan(loanId);
        requireOwnerOrLibrarian(loan, principal);
        int days = request != null && request.days() != null ? request.days() : LoanPolicy.DEFAULT_RENEWAL_DAYS;
        return LoanResponse.from(loanLifecycleService.renew(loan, days), now());
    }

    public LoanResponse returnLoan(UUID loanId, ReturnLoanRequest request, JwtAuthenticationPrincipal principal) {
        Loan loan = lockLoan(loanId);
        requireOwnerOrLibrarian(loan, principal);
        LibraryUser actor = userRepository.findById(principal.userId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.USER_NOT_FOUND));
        Loan returned = loanLifecycleService.returnLoan(
                loan,
                request != null ? request.condition() : null,
                request != null ? request.notes() : null,
                actor
        );
        return LoanResponse.from(returned, now());
    }

    public FineResponse calculateFine(UUID loanId) {
        Loan loan = lockLoan(loanId);
        BigDecimal fine = loanLifecycleService.calculateFine(loan);
        return new FineResponse(loan.getId(), fine, loanLifecycleService.daysOverdue(loan), loan.isFinePaid());
    }

    public FineResponse payFine(UUID loanId) {
        Loan loan = loanLifecycleService.payFine(lockLoan(loanId));
        return new FineResponse(loan.getId(), loan.getFineAmount(), loanLifecycleService.daysOverdue(loan), loan.isFinePaid());
    }

    @Transactional(readOnly = true)
    public LoanStatisticsResponse statistics() {
        long total = loanRepository.count();
        long active = loanRepository.countByStatus(LoanStatus.BORROWED);
        long overdue = loanRepository.countByStatus(LoanStatus.OVERDUE);
        long returned = loanRepository.countByStatus(LoanStatus.RETURNED);
        BigDecimal returnRate = total == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(returned * 100).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
        return new LoanStatisticsResponse(total, active, overdue, returned, returnRate);
    }

    private LoanListResponse page(UUID borrowerId, Set<LoanStatus> statuses, int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        Page<Loan> result = loanRepository.search(borrowerId, statuses, PageRequest.of(safePage, safeSize));
        OffsetDateTime now = now();
        List<LoanResponse> items = result.getContent().stream()
                .map(loan -> LoanResponse.from(loan, now))
                .toList();
        return new LoanListResponse(items, result.getNumber(), result.getSize(), result.getTotalElements(), result.getTotalPages());
    }

    private Loan lockLoan(UUID loanId) {
        return loanRepository.findByIdForUpdate(loanId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.LOAN_NOT_FOUND));
    }

    private static void requireOwnerOrLibrarian(Loan loan, JwtAuthenticationPrincipal principal) {
        if (!principal.isLibrarian() && !loan.getBorrower().getId().equals(principal.userId())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, ProblemCodes.FORBIDDEN, "Not your loan");
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
