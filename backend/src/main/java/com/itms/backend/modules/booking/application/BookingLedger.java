package com.itms.backend.modules.booking.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingActor;
import com.itms.backend.modules.booking.domain.BookingDetails;
import com.itms.backend.modules.booking.domain.BookingException;
import com.itms.backend.modules.booking.domain.BookingNumber;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.domain.BookingTransition;
import com.itms.backend.modules.booking.domain.TimeInterval;
import com.itms.backend.modules.resource.application.ResourceRegistry;
import com.itms.backend.modules.resource.domain.BookableResource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns booking records. Creation validates and inserts under the resource lock so two overlapping
 * requests for the same resource cannot both be stored.
 */
@Component
public class BookingLedger {

    private static final Logger log = LoggerFactory.getLogger(BookingLedger.class);

    private final ResourceRegistry resourceRegistry;
    private final ConflictDetector conflictDetector;
    private final BookingStatusWorkflow statusWorkflow;
    private final BookingStore bookingStore;
    private final ResourceLock resourceLock;
    private final Clock clock;

    public BookingLedger(
            ResourceRegistry resourceRegistry,
            ConflictDetector conflictDetector,
            BookingStatusWorkflow statusWorkflow,
            BookingStore bookingStore,
            ResourceLock resourceLock,
            Clock clock
    ) {
        this.resourceRegistry = resourceRegistry;
        this.conflictDetector = conflictDetector;
        this.statusWorkflow = statusWorkflow;
        this.bookingStore = bookingStore;
        this.resourceLock = resourceLock;
        this.clock = clock;
    }

    public Booking create(UUID resourceId, UUID requesterId, TimeInterval interval, BookingDetails details) {
        return resourceLock.withLock(resourceId, () -> {
            BookableResource resource = resourceRegistry.getResource(resourceId);
            if (!resourceRegistry.isBookable(resource)) {
                throw BookingException.resourceUnavailable(resourceId, resource.getStatus().name());
            }
            if (conflictDetector.hasConflict(resourceId, interval)) {
                throw BookingException.conflict(resourceId);
            }
            OffsetDateTime now = OffsetDateTime.now(clock);
            Booking booking = Booking.pending(resourceId, requesterId, interval, details);
            booking.assignNumber(BookingNumber.issue(now));
            booking.touch(now);
            Booking saved = bookingStore.save(booking);
            log.info("Booking {} ({}) created on resource {} for [{}, {})",
                    saved.getBookingNumber(), saved.getId(), resourceId, interval.start(), interval.end());
            return saved;
        });
    }

    public Booking get(UUID bookingId) {
        return bookingStore.findById(bookingId)
                .orElseThrow(() -> BookingException.bookingNotFound(bookingId));
    }

    /**
     * Bookings of a resource ordered by start; an empty or {@code null} filter means every status.
     */
    public List<Booking> listForResource(UUID resourceId, Collection<BookingStatus> statusFilter) {
        resourceRegistry.getResource(resourceId);
        Collection<BookingStatus> statuses = statusFilter == null || statusFilter.isEmpty()
                ? EnumSet.allOf(BookingStatus.class)
                : statusFilter;
        return bookingStore.findByResourceAndStatusIn(resourceId, statuses);
    }

    public BookingTransition cancel(UUID bookingId, BookingActor actor, String note) {
        return statusWorkflow.transition(bookingId, BookingStatus.CANCELLED, actor, note);
    }
}
