package com.itms.backend.modules.booking.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BookingRepository extends JpaRepository<Booking, UUID>, BookingRepositoryCustom {

    @Query("select b.resourceId from Booking b where b.id = :id")
    Optional<UUID> findResourceIdById(@Param("id") UUID id);

    List<Booking> findByResourceIdAndStatusInOrderByStartTimeAsc(UUID resourceId, Collection<BookingStatus> statuses);

    List<Booking> findByStatusAndStartTimeLessThanEqualOrderByStartTimeAsc(BookingStatus status, OffsetDateTime threshold);

    List<Booking> findByStatusAndEndTimeLessThanEqualOrderByEndTimeAsc(BookingStatus status, OffsetDateTime threshold);

    long countByStatus(BookingStatus status);

    @Query("""
            select count(b)
              from Booking b
             where b.startTime < :rangeEnd
               and b.endTime > :rangeStart
               and b.status in :statuses
            """)
    long countOverlapping(
            @Param("rangeStart") OffsetDateTime rangeStart,
            @Param("rangeEnd") OffsetDateTime rangeEnd,
            @Param("statuses") Collection<BookingStatus> statuses
    );
}
