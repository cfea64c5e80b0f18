package com.itms.backend.modules.resource.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.itms.backend.modules.resource.application.ResourceCatalog;
import com.itms.backend.modules.resource.domain.BookableResource;

import org.springframework.stereotype.Component;

@Component
public class JpaResourceCatalog implements ResourceCatalog {

    private final BookableResourceRepository repository;

    public JpaResourceCatalog(BookableResourceRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<BookableResource> findById(UUID resourceId) {
        return repository.findById(resourceId);
    }
}
