package com.libraria.backend.modules.loan.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.libraria.backend.global.jpa.AbstractTimestampedEntity;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.catalog.domain.Book;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "loan")
public class Loan extends AbstractTimestampedEntity {

    public static final int DEFAULT_MAX_RENEWALS = 2;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private LibraryUser borrower;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false, updatable = false)
    private Book book;

    @Column(name = "loan_date", nullable = false, updatable = false)
    private OffsetDateTime loanDate;

    @Column(name = "due_date", nullable = false)
    private OffsetDateTime dueDate;

    @Column(name = "return_date")
    private OffsetDateTime returnDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private LoanStatus status = LoanStatus.BORROWED;

    @Column(name = "renewal_count", nullable = false)
    private int renewalCount;

    @Column(name = "max_renewals", nullable = false)
    private int maxRenewals = DEFAULT_MAX_RENEWALS;

    @Column(name = "fine_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal fineAmount = BigDecimal.ZERO.setScale(2);

    @Column(name = "fine_paid", nullable = false)
    private boolean finePaid;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "issued_by")
    private LibraryUser issuedBy;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "returned_to")
    private LibraryUser returnedTo;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    protected Loan() {
    }

    public Loan(LibraryUser borrower, Book book, OffsetDateTime loanDate, OffsetDateTime dueDate) {
        this.borrower = borrower;
        this.book = book;
        this.loanDate = loanDate;
        this.dueDate = dueDate;
    }

    public boolean isOverdue(OffsetDateTime now) {
        return (status == LoanStatus.BORROWED && now.isAfter(dueDate)) || status == LoanStatus.OVERDUE;
    }

    /**
     * Whole days past the due date, zero when the loan is not overdue.
     */
    public long daysOverdue(OffsetDateTime now) {
        if (!isOverdue(now)) {
            return 0;
        }
        long days = Duration.between(dueDate, now).toDays();
        return Math.max(0, days);
    }

    public boolean canRenew(OffsetDateTime now) {
        return status == LoanStatus.BORROWED && renewalCount < maxRenewals && !isOverdue(now);
    }

    public BigDecimal fineFor(OffsetDateTime now, BigDecimal dailyRate) {
        return dailyRate.multiply(BigDecimal.valueOf(daysOverdue(now))).setScale(2, RoundingMode.HALF_UP);
    }

    public UUID getId() {
        return id;
    }

    public LibraryUser getBorrower() {
        return borrower;
    }

    public Book getBook() {
        return book;
    }

    public OffsetDateTime getLoanDate() {
        return loanDate;
    }

    public OffsetDateTime getDueDate() {
        return dueDate;
    }

    public void setDueDate(OffsetDateTime dueDate) {
        this.dueDate = dueDate;
    }

    public OffsetDateTime getReturnDate() {
        return returnDate;
    }

    public void setReturnDate(OffsetDateTime returnDate) {
        this.returnDate = returnDate;
    }

    public LoanStatus getStatus() {
        return status;
    }

    public void setStatus(LoanStatus status) {
        this.status = status;
    }

    public int getRenewalCount() {
        return renewalCount;
    }

    public void setRenewalCount(int renewalCount) {
        this.renewalCount = renewalCount;
    }

    public int getMaxRenewals() {
        return maxRenewals;
    }

    public void setMaxRenewals(int maxRenewals) {
        this.maxRenewals = maxRenewals;
    }

    public BigDecimal getFineAmount() {
        return fineAmount;
    }

    public void setFineAmount(BigDecimal fineAmount) {
        this.fineAmount = fineAmount;
    }

    public boolean isFinePaid() {
        return finePaid;
    }

    public void setFinePaid(boolean finePaid) {
        this.finePaid = finePaid;
    }

    public LibraryUser getIssuedBy() {
        return issuedBy;
    }

    public void setIssuedBy(LibraryUser issuedBy) {
        this.issuedBy = issuedBy;
    }

    public LibraryUser getReturnedTo() {
        return returnedTo;
    }

    public void setReturnedTo(LibraryUser returnedTo) {
        this.returnedTo = returnedTo;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
