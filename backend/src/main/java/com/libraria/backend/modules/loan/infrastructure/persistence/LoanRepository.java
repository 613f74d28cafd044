package com.libraria.backend.modules.loan.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.libraria.backend.modules.loan.domain.Loan;
import com.libraria.backend.modules.loan.domain.LoanStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoanRepository extends JpaRepository<Loan, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from Loan l where l.id = :id")
    Optional<Loan> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByBorrowerIdAndBookIdAndStatus(UUID borrowerId, UUID bookId, LoanStatus status);

    long countByBorrowerIdAndStatus(UUID borrowerId, LoanStatus status);

    long countByStatus(LoanStatus status);

    boolean existsByBookId(UUID bookId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from Loan l where l.status = :status and l.dueDate < :now order by l.dueDate")
    List<Loan> findByStatusAndDueDateBeforeForUpdate(
            @Param("status") LoanStatus status,
            @Param("now") OffsetDateTime now
    );

    @EntityGraph(attributePaths = {"book", "borrower"})
    @Query("""
            select l
              from Loan l
             where (:borrowerId is null or l.borrower.id = :borrowerId)
               and l.status in :statuses
             order by l.loanDate desc
            """)
    Page<Loan> search(
            @Param("borrowerId") UUID borrowerId,
            @Param("statuses") Collection<LoanStatus> statuses,
            Pageable pageable
    );
}
