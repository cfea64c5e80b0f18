package com.itms.backend.modules.booking.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record BookingHistoryEntryResponse(
        String actionType,
        UUID actorUserId,
        OffsetDateTime createdAt,
        Map<String, Object> detail
) {
}
