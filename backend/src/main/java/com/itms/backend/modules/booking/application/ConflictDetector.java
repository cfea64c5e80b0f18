package com.itms.backend.modules.booking.application;

import java.util.UUID;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.domain.TimeInterval;

import org.springframework.stereotype.Component;

/**
 * Linear scan of a resource's active bookings for a half-open overlap.
 */
@Component
public class ConflictDetector {

    private final BookingStore bookingStore;

    public ConflictDetector(BookingStore bookingStore) {
        this.bookingStore = bookingStore;
    }

    public boolean hasConflict(UUID resourceId, TimeInterval interval) {
        return hasConflict(resourceId, interval, null);
    }

    public boolean hasConflict(UUID resourceId, TimeInterval interval, UUID excludeBookingId) {
        for (Booking existing : bookingStore.findByResourceAndStatusIn(resourceId, BookingStatus.ACTIVE)) {
            if (excludeBookingId != null && excludeBookingId.equals(existing.getId())) {
                continue;
            }
            if (existing.getInterval().overlaps(interval)) {
                return true;
            }
        }
        return false;
    }
}
