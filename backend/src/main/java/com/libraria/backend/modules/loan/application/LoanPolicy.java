package com.libraria.backend.modules.loan.application;

import java.math.BigDecimal;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Lending rules read from {@code app.loan.*}.
 */
@Component
public class LoanPolicy {

    public static final int DEFAULT_RENEWAL_DAYS = 14;
    public static final int MIN_RENEWAL_DAYS = 1;
    public static final int MAX_RENEWAL_DAYS = 30;

    private final int periodDays;
    private final int maxRenewals;
    private final BigDecimal dailyFineRate;
    private final int maxActiveLoans;
    private final int borrowMaxAttempts;

    public LoanPolicy(
            @Value("${app.loan.period-days:14}") int periodDays,
            @Value("${app.loan.max-renewals:2}") int maxRenewals,
            @Value("${app.loan.daily-fine-rate:1.00}") BigDecimal dailyFineRate,
            @Value("${app.loan.max-active-loans:5}") int maxActiveLoans,
            @Value("${app.loan.borrow-max-attempts:3}") int borrowMaxAttempts
    ) {
        this.periodDays = periodDays;
        this.maxRenewals = maxRenewals;
        this.dailyFineRate = dailyFineRate;
        this.maxActiveLoans = maxActiveLoans;
        this.borrowMaxAttempts = Math.max(1, borrowMaxAttempts);
    }

    public static LoanPolicy defaults() {
        return new LoanPolicy(14, 2, new BigDecimal("1.00"), 5, 3);
    }

    public int periodDays() {
        return periodDays;
    }

    public int maxRenewals() {
        return maxRenewals;
    }

    public BigDecimal dailyFineRate() {
        return dailyFineRate;
    }

    public int maxActiveLoans() {
        return maxActiveLoans;
    }

    public int borrowMaxAttempts() {
        return borrowMaxAttempts;
    }
}
