package com.itms.backend.modules.resource.presentation.dto;

import com.itms.backend.modules.resource.domain.ResourceCategory;
import com.itms.backend.modules.resource.domain.ResourceStatus;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateResourceRequest(
        @Size(min = 1, max = 200, message = "name must be 1-200 characters")
        String name,
        ResourceCategory category,
        @Positive(message = "capacity must be positive")
        Integer capacity,
        ResourceStatus status,
        @Size(max = 200, message = "location must be at most 200 characters")
        String location,
        String description,
        @Size(max = 500, message = "imageUrl must be at most 500 characters")
        String imageUrl,
        String specifications
) {
}
