package com.libraria.backend.modules.loan.application;

import java.util.UUID;

import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.loan.domain.LoanStatus;
import com.libraria.backend.modules.loan.infrastructure.persistence.LoanRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class BorrowingEligibility {

    private final LoanRepository loanRepository;
    private final LoanPolicy loanPolicy;

    public BorrowingEligibility(LoanRepository loanRepository, LoanPolicy loanPolicy) {
        this.loanRepository = loanRepository;
        this.loanPolicy = loanPolicy;
    }

    public long activeLoansCount(UUID userId) {
        return loanRepository.countByBorrowerIdAndStatus(userId, LoanStatus.BORROWED);
    }

    public boolean canBorrowBooks(LibraryUser user) {
        return canBorrowBooks(user, activeLoansCount(user.getId()));
    }

    public boolean canBorrowBooks(LibraryUser user, long activeLoansCount) {
        return user.isActiveMember() && activeLoansCount < loanPolicy.maxActiveLoans();
    }
}
