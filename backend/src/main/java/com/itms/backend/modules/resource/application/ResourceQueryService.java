package com.itms.backend.modules.resource.application;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.itms.backend.modules.resource.domain.ResourceCategory;
import com.itms.backend.modules.resource.domain.ResourceStatus;
import com.itms.backend.modules.resource.infrastructure.persistence.BookableResourceRepository;
import com.itms.backend.modules.resource.presentation.dto.ResourceResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(readOnly = true)
public class ResourceQueryService {

    private final BookableResourceRepository resourceRepository;
    private final ResourceRegistry resourceRegistry;

    public ResourceQueryService(BookableResourceRepository resourceRepository, ResourceRegistry resourceRegistry) {
        this.resourceRepository = resourceRepository;
        this.resourceRegistry = resourceRegistry;
    }

    public List<ResourceResponse> listResources(String category, String status) {
        return resourceRepository.search(parseCategory(category), parseStatus(status)).stream()
                .map(ResourceResponse::from)
                .toList();
    }

    public ResourceResponse getResource(UUID resourceId) {
        return ResourceResponse.from(resourceRegistry.getResource(resourceId));
    }

    private ResourceCategory parseCategory(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return ResourceCategory.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_CATEGORY");
        }
    }

    private ResourceStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return ResourceStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_STATUS");
        }
    }
}
