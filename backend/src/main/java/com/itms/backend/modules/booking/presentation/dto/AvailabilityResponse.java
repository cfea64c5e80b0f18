package com.itms.backend.modules.booking.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record AvailabilityResponse(
        UUID resourceId,
        OffsetDateTime start,
        OffsetDateTime end,
        boolean free
) {
}
