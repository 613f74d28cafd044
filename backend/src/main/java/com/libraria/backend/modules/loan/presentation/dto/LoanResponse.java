package com.libraria.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.libraria.backend.modules.loan.domain.Loan;
import com.libraria.backend.modules.loan.domain.LoanStatus;

public record LoanResponse(
        UUID id,
        UUID userId,
        String username,
        UUID bookId,
        String bookTitle,
        String bookAuthor,
        String bookIsbn,
        OffsetDateTime loanDate,
        OffsetDateTime dueDate,
        OffsetDateTime returnDate,
        LoanStatus status,
        int renewalCount,
        int maxRenewals,
        BigDecimal fineAmount,
        boolean finePaid,
        boolean overdue,
        long daysOverdue,
        boolean canRenew,
        UUID issuedById,
        UUID returnedToId,
        String notes
) {

    public static LoanResponse from(Loan loan, OffsetDateTime now) {
        return new LoanResponse(
                loan.getId(),
                loan.getBorrower().getId(),
                loan.getBorrower().getUsername(),
                loan.getBook().getId(),
                loan.getBook().getTitle(),
                loan.getBook().getAuthor(),
                loan.getBook().getIsbn(),
                loan.getLoanDate(),
                loan.getDueDate(),
                loan.getReturnDate(),
                loan.getStatus(),
                loan.getRenewalCount(),
                loan.getMaxRenewals(),
                loan.getFineAmount(),
                loan.isFinePaid(),
                loan.isOverdue(now),
                loan.daysOverdue(now),
                loan.canRenew(now),
                loan.getIssuedBy() != null ? loan.getIssuedBy().getId() : null,
                loan.getReturnedTo() != null ? loan.getReturnedTo().getId() : null,
                loan.getNotes()
        );
    }
}
