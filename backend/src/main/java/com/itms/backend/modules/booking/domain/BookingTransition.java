package com.itms.backend.modules.booking.domain;

/**
 * A status change that was applied to {@code booking}.
 */
public record BookingTransition(Booking booking, BookingStatus from, BookingStatus to, BookingActor actor, String note) {
}
