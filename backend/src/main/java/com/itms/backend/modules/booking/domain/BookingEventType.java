package com.itms.backend.modules.booking.domain;

public enum BookingEventType {
    CREATED,
    APPROVED,
    REJECTED,
    CANCELLED
}
