package com.libraria.backend.modules.catalog.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.libraria.backend.modules.catalog.domain.Book;
import com.libraria.backend.modules.catalog.domain.BookGenre;
import com.libraria.backend.modules.catalog.domain.BookStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BookRepository extends JpaRepository<Book, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Book b where b.id = :id")
    Optional<Book> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByIsbn(String isbn);

    boolean existsByIsbnAndIdNot(String isbn, UUID id);

    @Query("""
            select b
              from Book b
             where (:genre is null or b.genre = :genre)
               and (:status is null or b.status = :status)
               and (:availableOnly = false or (b.status = com.libraria.backend.modules.catalog.domain.BookStatus.AVAILABLE
                                                and b.availableCopies > 0))
               and (
                     :searchPattern is null
                  or lower(b.title) like :searchPattern
                  or lower(b.author) like :searchPattern
                  or lower(b.isbn) like :searchPattern
                  or lower(b.publisher) like :searchPattern
               )
             order by lower(b.title), b.id
            """)
    Page<Book> search(
            @Param("genre") BookGenre genre,
            @Param("status") BookStatus status,
            @Param("availableOnly") boolean availableOnly,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );

    List<Book> findTop10ByOrderByTimesBorrowedDescTitleAsc();

    List<Book> findTop10ByTotalRatingsGreaterThanOrderByAverageRatingDescTotalRatingsDesc(int minRatings);
}
