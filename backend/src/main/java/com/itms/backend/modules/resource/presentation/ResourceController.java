package com.itms.backend.modules.resource.presentation;

import java.util.List;
import java.util.UUID;

import com.itms.backend.modules.resource.application.ResourceQueryService;
import com.itms.backend.modules.resource.presentation.dto.ResourceResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/resources")
@Tag(name = "Resources")
public class ResourceController {

    private final ResourceQueryService resourceQueryService;

    public ResourceController(ResourceQueryService resourceQueryService) {
        this.resourceQueryService = resourceQueryService;
    }

    @Operation(summary = "List resources, optionally by category and status")
    @GetMapping
    public ResponseEntity<List<ResourceResponse>> listResources(
            @RequestParam(name = "category", required = false) String category,
            @RequestParam(name = "status", required = false) String status
    ) {
        return ResponseEntity.ok(resourceQueryService.listResources(category, status));
    }

    @GetMapping("/{resourceId}")
    public ResponseEntity<ResourceResponse> getResource(@PathVariable("resourceId") UUID resourceId) {
        return ResponseEntity.ok(resourceQueryService.getResource(resourceId));
    }
}
