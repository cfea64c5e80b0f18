package com.itms.backend.modules.booking.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingStatus;

public interface BookingRepositoryCustom {

    List<Booking> searchBookings(UUID resourceId, UUID requesterId, BookingStatus status);

    List<Booking> findOverlapping(UUID resourceId, OffsetDateTime rangeStart, OffsetDateTime rangeEnd,
                                  Collection<BookingStatus> statuses);
}
