package com.itms.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String loginId,
        String displayName,
        String email,
        String department,
        String role,
        List<String> capabilities,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
