package com.itms.backend.modules.booking.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingActor;
import com.itms.backend.modules.booking.domain.BookingDetails;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.domain.TimeInterval;
import com.itms.backend.support.InMemoryBookingStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConflictDetectorTest {

    private static final OffsetDateTime TEN = OffsetDateTime.parse("2025-03-10T10:00:00Z");
    private static final UUID RESOURCE = UUID.randomUUID();
    private static final UUID OTHER_RESOURCE = UUID.randomUUID();

    private InMemoryBookingStore store;
    private ConflictDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryBookingStore();
        detector = new ConflictDetector(store);
    }

    @Test
    void pendingBookingBlocksOverlap() {
        store.save(booking(RESOURCE, TEN, TEN.plusHours(1)));

        assertThat(detector.hasConflict(RESOURCE, TimeInterval.of(TEN.plusMinutes(30), TEN.plusMinutes(90)))).isTrue();
    }

    @Test
    void touchingIntervalIsNotAConflict() {
        store.save(booking(RESOURCE, TEN, TEN.plusHours(1)));

        assertThat(detector.hasConflict(RESOURCE, TimeInterval.of(TEN.plusHours(1), TEN.plusHours(2)))).isFalse();
        assertThat(detector.hasConflict(RESOURCE, TimeInterval.of(TEN.minusHours(1), TEN))).isFalse();
    }

    @Test
    void otherResourcesAndInactiveBookingsAreIgnored() {
        store.save(booking(OTHER_RESOURCE, TEN, TEN.plusHours(1)));
        Booking cancelled = booking(RESOURCE, TEN, TEN.plusHours(1));
        cancelled.applyTransition(BookingStatus.CANCELLED, BookingActor.requester(cancelled.getRequesterId()), null, TEN);
        store.save(cancelled);

        assertThat(detector.hasConflict(RESOURCE, TimeInterval.of(TEN, TEN.plusHours(1)))).isFalse();
    }

    @Test
    void excludedBookingDoesNotConflictWithItself() {
        Booking existing = store.save(booking(RESOURCE, TEN, TEN.plusHours(1)));

        assertThat(detector.hasConflict(RESOURCE, existing.getInterval(), existing.getId())).isFalse();
        assertThat(detector.hasConflict(RESOURCE, existing.getInterval())).isTrue();
    }

    private Booking booking(UUID resourceId, OffsetDateTime start, OffsetDateTime end) {
        return Booking.pending(resourceId, UUID.randomUUID(), TimeInterval.of(start, end), BookingDetails.titled("sync"));
    }
}
