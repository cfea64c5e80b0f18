package com.itms.backend.modules.admin.presentation;

import com.itms.backend.modules.admin.application.AdminReadService;
import com.itms.backend.modules.admin.presentation.dto.AdminDashboardResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@Tag(name = "Admin dashboard")
public class AdminDashboardController {

    private final AdminReadService adminReadService;

    public AdminDashboardController(AdminReadService adminReadService) {
        this.adminReadService = adminReadService;
    }

    @Operation(summary = "Booking and resource statistics")
    @GetMapping("/dashboard")
    public ResponseEntity<AdminDashboardResponse> getDashboard() {
        return ResponseEntity.ok(adminReadService.getDashboard());
    }
}
