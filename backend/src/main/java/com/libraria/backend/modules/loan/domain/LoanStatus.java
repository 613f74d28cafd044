package com.libraria.backend.modules.loan.domain;

public enum LoanStatus {
    BORROWED,
    RETURNED,
    OVERDUE,
    LOST,
    DAMAGED;

    public boolean isOpen() {
        return this == BORROWED || this == OVERDUE;
    }
}
