package com.itms.backend.modules.booking.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingActor;
import com.itms.backend.modules.booking.domain.BookingDetails;
import com.itms.backend.modules.booking.domain.BookingErrorKind;
import com.itms.backend.modules.booking.domain.BookingException;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.domain.TimeInterval;
import com.itms.backend.modules.resource.domain.BookableResource;
import com.itms.backend.modules.resource.domain.ResourceCategory;
import com.itms.backend.modules.resource.domain.ResourceStatus;
import com.itms.backend.support.BookingEngineFixture;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BookingScenarioTest {

    private static final OffsetDateTime TEN = OffsetDateTime.parse("2025-03-10T10:00:00Z");

    @Test
    @DisplayName("회의실 예약: 생성, 충돌, 승인, 시작 후 취소 거부, 연속 예약 허용")
    void meetingRoomDay() {
        BookingEngineFixture engine = new BookingEngineFixture(TEN.minusHours(2));
        BookableResource room = engine.catalog.add("room-1", ResourceCategory.MEETING_ROOM, ResourceStatus.AVAILABLE);
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        BookingActor manager = BookingActor.approver(UUID.randomUUID());

        Booking a = engine.ledger.create(room.getId(), alice, TimeInterval.of(TEN, TEN.plusHours(1)),
                BookingDetails.titled("A"));
        assertThat(a.getStatus()).isEqualTo(BookingStatus.PENDING);

        assertThatThrownBy(() -> engine.ledger.create(room.getId(), bob,
                TimeInterval.of(TEN.plusMinutes(30), TEN.plusMinutes(90)), BookingDetails.titled("B")))
                .isInstanceOf(BookingException.class)
                .extracting("kind")
                .isEqualTo(BookingErrorKind.BOOKING_CONFLICT);

        engine.workflow.transition(a.getId(), BookingStatus.APPROVED, manager, null);
        assertThat(engine.ledger.get(a.getId()).getStatus()).isEqualTo(BookingStatus.APPROVED);

        engine.clock.set(TEN.plusMinutes(1));
        assertThatThrownBy(() -> engine.ledger.cancel(a.getId(), BookingActor.requester(alice), null))
                .isInstanceOf(BookingException.class)
                .extracting("kind")
                .isEqualTo(BookingErrorKind.INVALID_TRANSITION);
        assertThat(engine.ledger.get(a.getId()).getStatus()).isEqualTo(BookingStatus.APPROVED);

        Booking c = engine.ledger.create(room.getId(), bob, TimeInterval.of(TEN.plusHours(1), TEN.plusHours(2)),
                BookingDetails.titled("C"));
        assertThat(c.getStatus()).isEqualTo(BookingStatus.PENDING);
    }
}
