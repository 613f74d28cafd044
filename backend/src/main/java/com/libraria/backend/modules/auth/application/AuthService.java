package com.libraria.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;

import com.libraria.backend.global.error.ProblemCodes;
import com.libraria.backend.global.error.ProblemException;
import com.libraria.backend.modules.auth.domain.LibraryUser;
import com.libraria.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.libraria.backend.modules.auth.presentation.dto.AuthResponse;
import com.libraria.backend.modules.auth.presentation.dto.LoginRequest;
import com.libraria.backend.modules.auth.presentation.dto.RegisterRequest;
import com.libraria.backend.modules.auth.presentation.dto.TokenResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final LibraryUserRepository userRepository;
    private final UserAccountService userAccountService;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            LibraryUserRepository userRepository,
            UserAccountService userAccountService,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.userAccountService = userAccountService;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public AuthResponse register(RegisterRequest request) {
        if (!request.password().equals(request.passwordConfirm())) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ProblemCodes.PASSWORD_MISMATCH,
                    "Password fields didn't match");
        }
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        String username = request.username().trim();
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.EMAIL_TAKEN);
        }
        if (userRepository.existsByUsernameIgnoreCase(username)) {
            throw new ProblemException(HttpStatus.CONFLICT, ProblemCodes.USERNAME_TAKEN);
        }

        LibraryUser user = new LibraryUser();
        user.setEmail(email);
        user.setUsername(username);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setPhoneNumber(StringUtils.hasText(request.phoneNumber()) ? request.phoneNumber().trim() : null);
        user.setAddress(StringUtils.hasText(request.address()) ? request.address().trim() : null);
        user.setDateOfBirth(request.dateOfBirth());
        user.setLibrarian(false);
        user.setActiveMember(true);
        user.setMembershipDate(OffsetDateTime.now(clock));
        LibraryUser saved = userRepository.save(user);
        log.info("Registered library member {}", saved.getId());

        return issue(saved);
    }

    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        LibraryUser user = userRepository.findByEmailIgnoreCase(request.email().trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, ProblemCodes.INVALID_CREDENTIALS));
        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, ProblemCodes.INVALID_CREDENTIALS);
        }
        return issue(user);
    }

    private AuthResponse issue(LibraryUser user) {
        TokenResponse tokens = jwtTokenService.issueAccessToken(user.getId(), user.getEmail(), user.roleCodes());
        return new AuthResponse(tokens, userAccountService.toProfile(user));
    }
}
