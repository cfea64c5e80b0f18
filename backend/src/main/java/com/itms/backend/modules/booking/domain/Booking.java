package com.itms.backend.modules.booking.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.itms.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * 자원 예약 엔터티.
 *
 * <p>Only {@code BookingStatusWorkflow} moves {@link #getStatus() status}; it goes through
 * {@link #applyTransition}, which also stamps the decision fields. The booking number is assigned once
 * by the ledger; everything else on the record is fixed at creation.
 */
@Entity
@Table(name = "booking")
public class Booking extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "booking_number", nullable = false, updatable = false, unique = true, length = 20)
    private String bookingNumber;

    @Column(name = "resource_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID resourceId;

    @Column(name = "requester_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID requesterId;

    @Column(name = "start_time", nullable = false, updatable = false)
    private OffsetDateTime startTime;

    @Column(name = "end_time", nullable = false, updatable = false)
    private OffsetDateTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private BookingStatus status;

    @Embedded
    private BookingDetails details;

    @Column(name = "approver_id", columnDefinition = "uuid")
    private UUID approverId;

    @Column(name = "approval_note")
    private String approvalNote;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Booking() {
    }

    public static Booking pending(UUID resourceId, UUID requesterId, TimeInterval interval, BookingDetails details) {
        Booking booking = new Booking();
        booking.resourceId = Objects.requireNonNull(resourceId, "resourceId");
        booking.requesterId = Objects.requireNonNull(requesterId, "requesterId");
        booking.startTime = interval.start();
        booking.endTime = interval.end();
        booking.details = details != null ? details : BookingDetails.titled("Booking");
        booking.status = BookingStatus.PENDING;
        return booking;
    }

    public void assignNumber(String bookingNumber) {
        if (this.bookingNumber != null) {
            throw new IllegalStateException("booking number already assigned: " + this.bookingNumber);
        }
        this.bookingNumber = Objects.requireNonNull(bookingNumber, "bookingNumber");
    }

    public void applyTransition(BookingStatus target, BookingActor actor, String note, OffsetDateTime now) {
        switch (target) {
            case APPROVED -> {
                this.approverId = actor.userId();
                this.approvedAt = now;
                this.approvalNote = note;
            }
            case REJECTED -> {
                this.approverId = actor.userId();
                this.rejectionReason = note;
            }
            case CANCELLED -> {
                this.cancelledAt = now;
                this.cancellationReason = note;
            }
            default -> {
            }
        }
        this.status = target;
        touch(now);
    }

    public UUID getId() {
        return id;
    }

    public String getBookingNumber() {
        return bookingNumber;
    }

    public UUID getResourceId() {
        return resourceId;
    }

    public UUID getRequesterId() {
        return requesterId;
    }

    public OffsetDateTime getStartTime() {
        return startTime;
    }

    public OffsetDateTime getEndTime() {
        return endTime;
    }

    public TimeInterval getInterval() {
        return new TimeInterval(startTime, endTime);
    }

    public BookingStatus getStatus() {
        return status;
    }

    public BookingDetails getDetails() {
        return details;
    }

    public UUID getApproverId() {
        return approverId;
    }

    public String getApprovalNote() {
        return approvalNote;
    }

    public String getRejectionReason() {
        return rejectionReason;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public OffsetDateTime getApprovedAt() {
        return approvedAt;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }

    public long getVersion() {
        return version;
    }
}
