package com.itms.backend.modules.resource.presentation;

import java.net.URI;
import java.util.UUID;

import com.itms.backend.global.security.SecurityUtils;
import com.itms.backend.modules.resource.application.ResourceAdminService;
import com.itms.backend.modules.resource.presentation.dto.CreateResourceRequest;
import com.itms.backend.modules.resource.presentation.dto.ResourceResponse;
import com.itms.backend.modules.resource.presentation.dto.UpdateResourceRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/resources")
@Tag(name = "Admin resources")
public class AdminResourceController {

    private final ResourceAdminService resourceAdminService;

    public AdminResourceController(ResourceAdminService resourceAdminService) {
        this.resourceAdminService = resourceAdminService;
    }

    @Operation(summary = "Register a bookable resource")
    @PostMapping
    public ResponseEntity<ResourceResponse> createResource(@Valid @RequestBody CreateResourceRequest request) {
        ResourceResponse created = resourceAdminService.createResource(request, SecurityUtils.getCurrentUserId());
        return ResponseEntity.created(URI.create("/resources/" + created.id())).body(created);
    }

    @PatchMapping("/{resourceId}")
    public ResponseEntity<ResourceResponse> updateResource(
            @PathVariable("resourceId") UUID resourceId,
            @Valid @RequestBody UpdateResourceRequest request
    ) {
        return ResponseEntity.ok(resourceAdminService.updateResource(resourceId, request, SecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Retire a resource; it stops accepting new bookings")
    @PostMapping("/{resourceId}/retire")
    public ResponseEntity<ResourceResponse> retireResource(@PathVariable("resourceId") UUID resourceId) {
        return ResponseEntity.ok(resourceAdminService.retireResource(resourceId, SecurityUtils.getCurrentUserId()));
    }
}
