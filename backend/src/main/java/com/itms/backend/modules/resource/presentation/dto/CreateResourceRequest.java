package com.itms.backend.modules.resource.presentation.dto;

import com.itms.backend.modules.resource.domain.ResourceCategory;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateResourceRequest(
        @NotBlank(message = "name is required")
        @Size(max = 200, message = "name must be at most 200 characters")
        String name,
        @NotNull(message = "category is required")
        ResourceCategory category,
        @Positive(message = "capacity must be positive")
        Integer capacity,
        @Size(max = 200, message = "location must be at most 200 characters")
        String location,
        String description,
        @Size(max = 500, message = "imageUrl must be at most 500 characters")
        String imageUrl,
        String specifications
) {
}
