package com.libraria.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    public static final String ROLE_MEMBER = "MEMBER";
    public static final String ROLE_LIBRARIAN = "LIBRARIAN";

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, ProblemCodes.UNAUTHORIZED));
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    public static boolean hasRole(String roleCode) {
        return getCurrentPrincipal().roles().contains(roleCode);
    }

    public static boolean isLibrarian() {
        return findCurrentPrincipal().map(JwtAuthenticationPrincipal::isLibrarian).orElse(false);
    }

    public static void requireLibrarian() {
        if (!hasRole(ROLE_LIBRARIAN)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, ProblemCodes.FORBIDDEN, "Librarian role required");
        }
    }
}
