package com.libraria.backend.modules.auth.application;

import java.util.Locale;
import java.util.UUID;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.libraria.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.libraria.backend.modules.auth.presentation.dto.UserFlagResponse;
import com.libraria.backend.modules.auth.presentation.dto.UserListResponse;
import com.libraria.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.libraria.backend.modules.loan.application.BorrowingEligibility;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final LibraryUserRepository userRepository;
    private final BorrowingEligibility borrowingEligibility;

    public UserAccountService(LibraryUserRepository userRepository, BorrowingEligibility borrowingEligibility) {
        this.userRepository = userRepository;
        this.borrowingEligibility = borrowingEligibility;
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        return toProfile(loadUser(userId));
    }

    public UserProfileResponse updateProfile(UUID userId, UpdateProfileRequest request) {
        LibraryUser user = loadUser(userId);
        if (request.firstName() != null) {
            user.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName().trim());
        }
        if (request.phoneNumber() != null) {
            user.setPhoneNumber(emptyToNull(request.phoneNumber()));
        }
        if (request.address() != null) {
            user.setAddress(emptyToNull(request.address()));
        }
        if (request.dateOfBirth() != null) {
            user.setDateOfBirth(request.dateOfBirth());
        }
        return toProfile(user);
    }

    @Transactional(readOnly = true)
    public UserListResponse listUsers(Boolean librarian, Boolean activeMember, String search, int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        String pattern = StringUtils.hasText(search)
                ? "%" + search.trim().toLowerCase(Locale.ROOT) + "%"
                : null;
        Page<LibraryUser> result = userRepository.search(librarian, activeMember, pattern, PageRequest.of(safePage, safeSize));
        return new UserListResponse(
                result.getContent().stream().map(this::toProfile).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                result.getTotalPages()
        );
    }

    public UserFlagResponse toggleLibrarian(UUID userId) {
        LibraryUser user = loadUser(userId);
        user.setLibrarian(!user.isLibrarian());
        log.info("User {} librarian flag set to {}", userId, user.isLibrarian());
        String message = user.isLibrarian()
                ? "User " + user.getUsername() + " is now a librarian"
                : "User " + user.getUsername() + " is no longer a librarian";
        return new UserFlagResponse(user.getId(), message, user.isLibrarian(), user.isActiveMember());
    }

    public UserFlagResponse toggleActiveMember(UUID userId) {
        LibraryUser user = loadUser(userId);
        user.setActiveMember(!user.isActiveMember());
        log.info("User {} active membership set to {}", userId, user.isActiveMember());
        String message = user.isActiveMember()
                ? "Membership of " + user.getUsername() + " activated"
                : "Membership of " + user.getUsername() + " deactivated";
        return new UserFlagResponse(user.getId(), message, user.isLibrarian(), user.isActiveMember());
    }

    @Transactional(readOnly = true)
    public LibraryUser loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ProblemCodes.USER_NOT_FOUND));
    }

    public UserProfileResponse toProfile(LibraryUser user) {
        long activeLoans = user.getId() == null ? 0 : borrowingEligibility.activeLoansCount(user.getId());
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getUsername(),
                user.getFirstName(),
                user.getLastName(),
                user.getFullName(),
                user.getPhoneNumber(),
                user.getAddress(),
                user.getDateOfBirth(),
                user.isLibrarian(),
                user.isActiveMember(),
                user.getMembershipDate(),
                activeLoans,
                borrowingEligibility.canBorrowBooks(user, activeLoans)
        );
    }

    private static String emptyToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
