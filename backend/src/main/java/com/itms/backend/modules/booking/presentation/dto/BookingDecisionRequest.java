package com.itms.backend.modules.booking.presentation.dto;

import jakarta.validation.constraints.Size;

public record BookingDecisionRequest(
        @Size(max = 1000, message = "note must be at most 1000 characters")
        String note
) {
}
