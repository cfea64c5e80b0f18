package com.itms.backend.modules.booking.application;

import java.util.UUID;

import com.itms.backend.modules.booking.domain.BookingStatus;

/**
 * Optional filters of a booking search; {@code null} means unfiltered.
 */
public record BookingSearchCriteria(UUID resourceId, UUID requesterId, BookingStatus status) {

    public static BookingSearchCriteria any() {
        return new BookingSearchCriteria(null, null, null);
    }
}
