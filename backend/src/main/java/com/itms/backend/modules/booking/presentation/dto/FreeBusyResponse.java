package com.itms.backend.modules.booking.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Slots are computed from bookings alone; {@code bookable} tells whether the resource takes new bookings at all.
 */
public record FreeBusyResponse(
        UUID resourceId,
        OffsetDateTime rangeStart,
        OffsetDateTime rangeEnd,
        boolean bookable,
        List<Slot> slots
) {

    public record Slot(OffsetDateTime start, OffsetDateTime end, boolean busy) {
    }
}
