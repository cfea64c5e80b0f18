package com.itms.backend.modules.booking.application;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.domain.TimeInterval;

/**
 * Storage port of the booking engine. Implementations translate store-specific overlap violations into
 * {@code BookingException.conflict} and transient failures into {@code BookingException.storeUnavailable}.
 */
public interface BookingStore {

    Booking save(Booking booking);

    Optional<Booking> findById(UUID bookingId);

    /**
     * Resource of a booking without loading it into the current unit of work, so it can be locked first.
     */
    Optional<UUID> findResourceIdOf(UUID bookingId);

    /**
     * Bookings of a resource in the given statuses, ordered by start ascending.
     */
    List<Booking> findByResourceAndStatusIn(UUID resourceId, Collection<BookingStatus> statuses);

    /**
     * Bookings in the given statuses whose interval overlaps {@code range}, ordered by start ascending.
     * A {@code null} resource id searches every resource.
     */
    List<Booking> findOverlapping(UUID resourceId, TimeInterval range, Collection<BookingStatus> statuses);

    List<Booking> search(BookingSearchCriteria criteria);

    /**
     * Bookings in {@code status} whose start is at or before {@code threshold}.
     */
    List<Booking> findByStatusStartingAtOrBefore(BookingStatus status, OffsetDateTime threshold);

    /**
     * Bookings in {@code status} whose end is at or before {@code threshold}.
     */
    List<Booking> findByStatusEndingAtOrBefore(BookingStatus status, OffsetDateTime threshold);
}
