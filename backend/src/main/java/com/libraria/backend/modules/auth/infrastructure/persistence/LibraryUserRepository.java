package com.libraria.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.libraria.backend.modules.auth.domain.LibraryUser;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LibraryUserRepository extends JpaRepository<LibraryUser, UUID> {

    @Query("select u from LibraryUser u where lower(u.email) = lower(:email)")
    Optional<LibraryUser> findByEmailIgnoreCase(@Param("email") String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from LibraryUser u where u.id = :id")
    Optional<LibraryUser> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByUsernameIgnoreCase(String username);

    @Query("""
            select u
              from LibraryUser u
             where (:librarian is null or u.librarian = :librarian)
               and (:activeMember is null or u.activeMember = :activeMember)
               and (
                     :searchPattern is null
                  or lower(u.email) like :searchPattern
                  or lower(u.username) like :searchPattern
                  or lower(u.firstName) like :searchPattern
                  or lower(u.lastName) like :searchPattern
               )
             order by lower(u.lastName), lower(u.firstName)
            """)
    Page<LibraryUser> search(
            @Param("librarian") Boolean librarian,
            @Param("activeMember") Boolean activeMember,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );
}
