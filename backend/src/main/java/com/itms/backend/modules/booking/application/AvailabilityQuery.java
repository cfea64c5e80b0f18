package com.itms.backend.modules.booking.application;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.domain.FreeBusySlot;
import com.itms.backend.modules.booking.domain.TimeInterval;
import com.itms.backend.modules.resource.application.ResourceRegistry;
import com.itms.backend.modules.resource.domain.BookableResource;

import org.springframework.stereotype.Component;

/**
 * Read-only availability answers. Both operations are free of side effects.
 */
@Component
public class AvailabilityQuery {

    private final ResourceRegistry resourceRegistry;
    private final ConflictDetector conflictDetector;
    private final BookingStore bookingStore;

    public AvailabilityQuery(ResourceRegistry resourceRegistry, ConflictDetector conflictDetector,
                             BookingStore bookingStore) {
        this.resourceRegistry = resourceRegistry;
        this.conflictDetector = conflictDetector;
        this.bookingStore = bookingStore;
    }

    public boolean isFree(UUID resourceId, TimeInterval interval) {
        BookableResource resource = resourceRegistry.getResource(resourceId);
        return resourceRegistry.isBookable(resource) && !conflictDetector.hasConflict(resourceId, interval);
    }

    /**
     * Busy and free slots covering {@code range} exactly, in start order. Busy slots are the active
     * bookings clipped to the range with touching or overlapping ones merged; free slots fill the gaps.
     */
    public List<FreeBusySlot> freeBusyIntervals(UUID resourceId, TimeInterval range) {
        resourceRegistry.getResource(resourceId);

        List<TimeInterval> busy = bookingStore.findOverlapping(resourceId, range, BookingStatus.ACTIVE).stream()
                .map(Booking::getInterval)
                .filter(interval -> interval.overlaps(range))
                .map(interval -> interval.clipTo(range))
                .sorted(Comparator.comparing(TimeInterval::start).thenComparing(TimeInterval::end))
                .toList();

        List<TimeInterval> merged = new ArrayList<>();
        for (TimeInterval interval : busy) {
            if (!merged.isEmpty()) {
                TimeInterval last = merged.get(merged.size() - 1);
                if (!interval.start().isAfter(last.end())) {
                    OffsetDateTime end = interval.end().isAfter(last.end()) ? interval.end() : last.end();
                    merged.set(merged.size() - 1, new TimeInterval(last.start(), end));
                    continue;
                }
            }
            merged.add(interval);
        }

        List<FreeBusySlot> slots = new ArrayList<>();
        OffsetDateTime cursor = range.start();
        for (TimeInterval interval : merged) {
            if (cursor.isBefore(interval.start())) {
                slots.add(FreeBusySlot.free(new TimeInterval(cursor, interval.start())));
            }
            slots.add(FreeBusySlot.busy(interval));
            cursor = interval.end();
        }
        if (cursor.isBefore(range.end())) {
            slots.add(FreeBusySlot.free(new TimeInterval(cursor, range.end())));
        }
        return List.copyOf(slots);
    }
}
