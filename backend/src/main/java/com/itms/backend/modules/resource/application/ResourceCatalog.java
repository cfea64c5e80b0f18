package com.itms.backend.modules.resource.application;

import java.util.Optional;
import java.util.UUID;

import com.itms.backend.modules.resource.domain.BookableResource;

/**
 * Read port over the resource store used by the booking engine.
 */
public interface ResourceCatalog {

    Optional<BookableResource> findById(UUID resourceId);
}
