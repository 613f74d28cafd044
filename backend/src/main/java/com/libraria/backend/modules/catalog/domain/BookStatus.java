package com.libraria.backend.modules.catalog.domain;

public enum BookStatus {
    AVAILABLE,
    BORROWED,
    RESERVED,
    MAINTENANCE,
    LOST,
    DAMAGED;

    /**
     * Statuses maintained automatically from the copy counters. Anything else is set by a librarian.
     */
    public boolean isCirculating() {
        return this == AVAILABLE || this == BORROWED;
    }
}
