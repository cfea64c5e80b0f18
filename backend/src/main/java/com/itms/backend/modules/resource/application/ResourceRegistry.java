package com.itms.backend.modules.resource.application;

import java.util.UUID;

import com.itms.backend.modules.booking.domain.BookingException;
import com.itms.backend.modules.resource.domain.BookableResource;

import org.springframework.stereotype.Component;

/**
 * Read-only view of resources for the booking engine.
 */
@Component
public class ResourceRegistry {

    private final ResourceCatalog resourceCatalog;

    public ResourceRegistry(ResourceCatalog resourceCatalog) {
        this.resourceCatalog = resourceCatalog;
    }

    public BookableResource getResource(UUID resourceId) {
        return resourceCatalog.findById(resourceId)
                .orElseThrow(() -> BookingException.resourceNotFound(resourceId));
    }

    public boolean isBookable(BookableResource resource) {
        return resource.getStatus() != null && resource.getStatus().acceptsBookings();
    }
}
