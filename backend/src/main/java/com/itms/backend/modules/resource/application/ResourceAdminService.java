package com.itms.backend.modules.resource.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.itms.backend.global.web.RequestIdFilter;
import com.itms.backend.modules.audit.application.AuditLogService;
import com.itms.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.itms.backend.modules.booking.domain.BookingException;
import com.itms.backend.modules.resource.domain.BookableResource;
import com.itms.backend.modules.resource.domain.ResourceStatus;
import com.itms.backend.modules.resource.infrastructure.persistence.BookableResourceRepository;
import com.itms.backend.modules.resource.presentation.dto.CreateResourceRequest;
import com.itms.backend.modules.resource.presentation.dto.ResourceResponse;
import com.itms.backend.modules.resource.presentation.dto.UpdateResourceRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Administrative create/update/retire of bookable resources. Existing bookings are left untouched;
 * a resource that is no longer AVAILABLE only stops accepting new ones.
 */
@Service
@Transactional
public class ResourceAdminService {

    private static final Logger log = LoggerFactory.getLogger(ResourceAdminService.class);

    private final BookableResourceRepository resourceRepository;
    private final AuditLogService auditLogService;

    public ResourceAdminService(BookableResourceRepository resourceRepository, AuditLogService auditLogService) {
        this.resourceRepository = resourceRepository;
        this.auditLogService = auditLogService;
    }

    public ResourceResponse createResource(CreateResourceRequest request, UUID actorUserId) {
        String name = request.name().trim();
        if (resourceRepository.existsByNameIgnoreCase(name)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "RESOURCE_NAME_TAKEN");
        }
        BookableResource resource = new BookableResource();
        resource.setName(name);
        resource.setCategory(request.category());
        resource.setCapacity(request.capacity() != null ? request.capacity() : 1);
        resource.setStatus(ResourceStatus.AVAILABLE);
        resource.setLocation(request.location());
        resource.setDescription(request.description());
        resource.setImageUrl(request.imageUrl());
        resource.setSpecifications(request.specifications());
        BookableResource saved = resourceRepository.save(resource);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("name", saved.getName());
        detail.put("category", saved.getCategory().name());
        detail.put("capacity", saved.getCapacity());
        audit("RESOURCE_CREATED", saved.getId(), actorUserId, detail);
        log.info("Resource {} created ({})", saved.getId(), saved.getCategory());
        return ResourceResponse.from(saved);
    }

    public ResourceResponse updateResource(UUID resourceId, UpdateResourceRequest request, UUID actorUserId) {
        BookableResource resource = resourceRepository.findById(resourceId)
                .orElseThrow(() -> BookingException.resourceNotFound(resourceId));
        if (resource.getStatus() == ResourceStatus.RETIRED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "RESOURCE_RETIRED");
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        if (request.name() != null && !request.name().trim().equals(resource.getName())) {
            String name = request.name().trim();
            if (resourceRepository.existsByNameIgnoreCase(name)) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "RESOURCE_NAME_TAKEN");
            }
            resource.setName(name);
            changes.put("name", name);
        }
        if (request.category() != null && request.category() != resource.getCategory()) {
            resource.setCategory(request.category());
            changes.put("category", request.category().name());
        }
        if (request.capacity() != null && request.capacity() != resource.getCapacity()) {
            resource.setCapacity(request.capacity());
            changes.put("capacity", request.capacity());
        }
        if (request.status() != null && request.status() != resource.getStatus()) {
            resource.setStatus(request.status());
            changes.put("status", request.status().name());
        }
        if (request.location() != null) {
            resource.setLocation(request.location());
            changes.put("location", request.location());
        }
        if (request.description() != null) {
            resource.setDescription(request.description());
            changes.put("description", request.description());
        }
        if (request.imageUrl() != null) {
            resource.setImageUrl(request.imageUrl());
            changes.put("imageUrl", request.imageUrl());
        }
        if (request.specifications() != null) {
            resource.setSpecifications(request.specifications());
            changes.put("specifications", request.specifications());
        }

        if (!changes.isEmpty()) {
            resourceRepository.save(resource);
            audit("RESOURCE_UPDATED", resource.getId(), actorUserId, changes);
            log.info("Resource {} updated: {}", resource.getId(), changes.keySet());
        }
        return ResourceResponse.from(resource);
    }

    public ResourceResponse retireResource(UUID resourceId, UUID actorUserId) {
        BookableResource resource = resourceRepository.findById(resourceId)
                .orElseThrow(() -> BookingException.resourceNotFound(resourceId));
        if (resource.getStatus() == ResourceStatus.RETIRED) {
            return ResourceResponse.from(resource);
        }
        ResourceStatus previous = resource.getStatus();
        resource.setStatus(ResourceStatus.RETIRED);
        resourceRepository.save(resource);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("previousStatus", previous.name());
        audit("RESOURCE_RETIRED", resource.getId(), actorUserId, detail);
        log.info("Resource {} retired", resource.getId());
        return ResourceResponse.from(resource);
    }

    private void audit(String actionType, UUID resourceId, UUID actorUserId, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(
                actionType,
                AuditLogService.RESOURCE_TYPE_RESOURCE,
                resourceId.toString(),
                actorUserId,
                RequestIdFilter.currentCorrelationId(),
                detail
        ));
    }
}
