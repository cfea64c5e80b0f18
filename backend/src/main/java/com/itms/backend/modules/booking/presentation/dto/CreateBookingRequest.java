package com.itms.backend.modules.booking.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateBookingRequest(
        @NotNull(message = "resourceId is required")
        UUID resourceId,
        @NotNull(message = "startTime is required")
        OffsetDateTime startTime,
        @NotNull(message = "endTime is required")
        OffsetDateTime endTime,
        @NotBlank(message = "title is required")
        @Size(max = 200, message = "title must be at most 200 characters")
        String title,
        @Size(max = 2000, message = "purpose must be at most 2000 characters")
        String purpose,
        @PositiveOrZero(message = "attendees must not be negative")
        Integer attendees,
        @Size(max = 200, message = "contactInfo must be at most 200 characters")
        String contactInfo,
        @Size(max = 2000, message = "specialRequirements must be at most 2000 characters")
        String specialRequirements
) {
}
