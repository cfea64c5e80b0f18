package com.itms.backend.modules.booking.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingDetails;

public record BookingResponse(
        UUID id,
        String bookingNumber,
        UUID resourceId,
        UUID requesterId,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        String status,
        UUID approverId,
        String title,
        String purpose,
        Integer attendees,
        String contactInfo,
        String specialRequirements,
        String approvalNote,
        String rejectionReason,
        String cancellationReason,
        OffsetDateTime approvedAt,
        OffsetDateTime cancelledAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static BookingResponse from(Booking booking) {
        BookingDetails details = booking.getDetails();
        return new BookingResponse(
                booking.getId(),
                booking.getBookingNumber(),
                booking.getResourceId(),
                booking.getRequesterId(),
                booking.getStartTime(),
                booking.getEndTime(),
                booking.getStatus().name(),
                booking.getApproverId(),
                details != null ? details.getTitle() : null,
                details != null ? details.getPurpose() : null,
                details != null ? details.getAttendees() : null,
                details != null ? details.getContactInfo() : null,
                details != null ? details.getSpecialRequirements() : null,
                booking.getApprovalNote(),
                booking.getRejectionReason(),
                booking.getCancellationReason(),
                booking.getApprovedAt(),
                booking.getCancelledAt(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
