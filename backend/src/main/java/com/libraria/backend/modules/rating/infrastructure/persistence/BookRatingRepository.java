package com.libraria.backend.modules.rating.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.libraria.backend.modules.rating.domain.BookRating;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BookRatingRepository extends JpaRepository<BookRating, UUID> {

    Optional<BookRating> findByUserIdAndBookId(UUID userId, UUID bookId);

    long countByBookId(UUID bookId);

    @Query("select coalesce(sum(r.rating), 0) from BookRating r where r.book.id = :bookId")
    long sumRatingsByBookId(@Param("bookId") UUID bookId);

    @EntityGraph(attributePaths = {"user", "book"})
    Page<BookRating> findByBookIdOrderByCreatedAtDesc(UUID bookId, Pageable pageable);

    @EntityGraph(attributePaths = {"user", "book"})
    Page<BookRating> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    @EntityGraph(attributePaths = {"user", "book"})
    Page<BookRating> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
