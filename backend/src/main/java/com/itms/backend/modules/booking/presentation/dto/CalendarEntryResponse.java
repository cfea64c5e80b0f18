package com.itms.backend.modules.booking.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CalendarEntryResponse(
        UUID bookingId,
        UUID resourceId,
        String resourceName,
        String title,
        OffsetDateTime start,
        OffsetDateTime end,
        String status,
        UUID requesterId
) {
}
