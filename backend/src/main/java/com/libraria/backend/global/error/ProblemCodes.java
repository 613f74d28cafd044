package com.libraria.backend.global.error;

/**
 * Stable error codes returned in {@link ProblemResponse#code()}.
 */
public final class ProblemCodes {

    public static final String BORROW_LIMIT_EXCEEDED = "BORROW_LIMIT_EXCEEDED";
    public static final String BOOK_UNAVAILABLE = "BOOK_UNAVAILABLE";
    public static final String DUPLICATE_ACTIVE_LOAN = "DUPLICATE_ACTIVE_LOAN";
    public static final String NOT_RENEWABLE = "NOT_RENEWABLE";
    public static final String INVALID_STATE = "INVALID_STATE";
    public static final String INVALID_DUE_DATE = "INVALID_DUE_DATE";
    public static final String CAPACITY_VIOLATION = "CAPACITY_VIOLATION";
    public static final String CONFLICT = "CONFLICT";

    public static final String BOOK_NOT_FOUND = "BOOK_NOT_FOUND";
    public static final String USER_NOT_FOUND = "USER_NOT_FOUND";
    public static final String LOAN_NOT_FOUND = "LOAN_NOT_FOUND";
    public static final String RATING_NOT_FOUND = "RATING_NOT_FOUND";

    public static final String DUPLICATE_ISBN = "DUPLICATE_ISBN";
    public static final String EMAIL_TAKEN = "EMAIL_TAKEN";
    public static final String USERNAME_TAKEN = "USERNAME_TAKEN";
    public static final String BOOK_HAS_LOANS = "BOOK_HAS_LOANS";
    public static final String CONSTRAINT_VIOLATION = "CONSTRAINT_VIOLATION";

    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String PASSWORD_MISMATCH = "PASSWORD_MISMATCH";

    private ProblemCodes() {
    }
}
