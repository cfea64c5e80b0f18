package com.itms.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record AdminDashboardResponse(
        long totalBookings,
        long pendingBookings,
        long approvedBookings,
        long todayBookings,
        long totalResources,
        long availableResources,
        List<SummaryCard> summary,
        OffsetDateTime generatedAt
) {

    public record SummaryCard(String id, String label, String value, String description) {
    }
}
