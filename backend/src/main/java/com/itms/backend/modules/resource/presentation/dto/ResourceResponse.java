package com.itms.backend.modules.resource.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.itms.backend.modules.resource.domain.BookableResource;

public record ResourceResponse(
        UUID id,
        String name,
        String category,
        int capacity,
        String status,
        boolean bookable,
        String location,
        String description,
        String imageUrl,
        String specifications,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ResourceResponse from(BookableResource resource) {
        return new ResourceResponse(
                resource.getId(),
                resource.getName(),
                resource.getCategory().name(),
                resource.getCapacity(),
                resource.getStatus().name(),
                resource.getStatus().acceptsBookings(),
                resource.getLocation(),
                resource.getDescription(),
                resource.getImageUrl(),
                resource.getSpecifications(),
                resource.getCreatedAt(),
                resource.getUpdatedAt()
        );
    }
}
