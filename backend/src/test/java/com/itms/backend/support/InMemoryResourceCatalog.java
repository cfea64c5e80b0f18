package com.itms.backend.support;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.itms.backend.modules.resource.application.ResourceCatalog;
import com.itms.backend.modules.resource.domain.BookableResource;
import com.itms.backend.modules.resource.domain.ResourceCategory;
import com.itms.backend.modules.resource.domain.ResourceStatus;

import org.springframework.test.util.ReflectionTestUtils;

public class InMemoryResourceCatalog implements ResourceCatalog {

    private final Map<UUID, BookableResource> resources = new ConcurrentHashMap<>();

    public BookableResource add(String name, ResourceCategory category, ResourceStatus status) {
        BookableResource resource = new BookableResource();
        ReflectionTestUtils.setField(resource, "id", UUID.randomUUID());
        resource.setName(name);
        resource.setCategory(category);
        resource.setCapacity(1);
        resource.setStatus(status);
        resources.put(resource.getId(), resource);
        return resource;
    }

    @Override
    public Optional<BookableResource> findById(UUID resourceId) {
        return Optional.ofNullable(resources.get(resourceId));
    }
}
