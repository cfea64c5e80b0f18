package com.itms.backend.modules.booking.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Published inside the booking transaction; listeners receive it only after commit.
 */
public record BookingLifecycleEvent(
        BookingEventType type,
        UUID bookingId,
        UUID resourceId,
        String resourceName,
        UUID requesterId,
        UUID actorUserId,
        String title,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        String note,
        UUID correlationId
) {
}
