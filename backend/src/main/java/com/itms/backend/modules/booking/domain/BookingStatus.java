package com.itms.backend.modules.booking.domain;

import java.util.EnumSet;
import java.util.Set;

public enum BookingStatus {
    PENDING,
    APPROVED,
    REJECTED,
    CONFIRMED,
    IN_USE,
    COMPLETED,
    CANCELLED;

    /**
     * Statuses that hold the resource's time slot. PENDING counts as a soft hold.
     */
    public static final Set<BookingStatus> ACTIVE = Set.copyOf(EnumSet.of(PENDING, APPROVED, CONFIRMED, IN_USE));

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == CANCELLED;
    }
}
