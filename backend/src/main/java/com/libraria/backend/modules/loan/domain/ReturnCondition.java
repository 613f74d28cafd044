package com.libraria.backend.modules.loan.domain;

public enum ReturnCondition {
    GOOD(LoanStatus.RETURNED),
    DAMAGED(LoanStatus.DAMAGED),
    LOST(LoanStatus.LOST);

    private final LoanStatus resultingStatus;

    ReturnCondition(LoanStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public LoanStatus resultingStatus() {
        return resultingStatus;
    }
}
