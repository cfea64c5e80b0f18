package com.itms.backend.modules.booking.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.itms.backend.modules.booking.application.BookingSearchCriteria;
import com.itms.backend.modules.booking.application.BookingStore;
import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingException;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.domain.TimeInterval;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

@Component
public class JpaBookingStore implements BookingStore {

    static final String OVERLAP_CONSTRAINT = "ex_booking_active_no_overlap";
    static final String INTERVAL_CONSTRAINT = "ck_booking_interval";

    private final BookingRepository bookingRepository;

    public JpaBookingStore(BookingRepository bookingRepository) {
        this.bookingRepository = bookingRepository;
    }

    @Override
    public Booking save(Booking booking) {
        try {
            return bookingRepository.saveAndFlush(booking);
        } catch (DataIntegrityViolationException ex) {
            String message = mostSpecificMessage(ex);
            if (message.contains(OVERLAP_CONSTRAINT)) {
                throw BookingException.conflict(booking.getResourceId());
            }
            if (message.contains(INTERVAL_CONSTRAINT)) {
                throw BookingException.invalidInterval("start must be before end");
            }
            throw ex;
        } catch (TransientDataAccessException ex) {
            throw BookingException.storeUnavailable("booking store temporarily unavailable", ex);
        }
    }

    @Override
    public Optional<Booking> findById(UUID bookingId) {
        return bookingRepository.findById(bookingId);
    }

    @Override
    public Optional<UUID> findResourceIdOf(UUID bookingId) {
        return bookingRepository.findResourceIdById(bookingId);
    }

    @Override
    public List<Booking> findByResourceAndStatusIn(UUID resourceId, Collection<BookingStatus> statuses) {
        return bookingRepository.findByResourceIdAndStatusInOrderByStartTimeAsc(resourceId, statuses);
    }

    @Override
    public List<Booking> findOverlapping(UUID resourceId, TimeInterval range, Collection<BookingStatus> statuses) {
        return bookingRepository.findOverlapping(resourceId, range.start(), range.end(), statuses);
    }

    @Override
    public List<Booking> search(BookingSearchCriteria criteria) {
        return bookingRepository.searchBookings(criteria.resourceId(), criteria.requesterId(), criteria.status());
    }

    @Override
    public List<Booking> findByStatusStartingAtOrBefore(BookingStatus status, OffsetDateTime threshold) {
        return bookingRepository.findByStatusAndStartTimeLessThanEqualOrderByStartTimeAsc(status, threshold);
    }

    @Override
    public List<Booking> findByStatusEndingAtOrBefore(BookingStatus status, OffsetDateTime threshold) {
        return bookingRepository.findByStatusAndEndTimeLessThanEqualOrderByEndTimeAsc(status, threshold);
    }

    private String mostSpecificMessage(DataIntegrityViolationException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = cause.getMessage();
        return message == null ? "" : message;
    }
}
