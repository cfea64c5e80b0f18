package com.itms.backend.modules.booking.application;

import com.itms.backend.modules.booking.domain.BookingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 확정된 예약의 시작과 종료 시각이 지나면 상태를 자동으로 진행시킨다.
 */
@Component
public class BookingLifecycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(BookingLifecycleScheduler.class);

    private final BookingService bookingService;

    public BookingLifecycleScheduler(BookingService bookingService) {
        this.bookingService = bookingService;
    }

    @Scheduled(
            fixedDelayString = "${app.booking.sweep-interval:PT1M}",
            initialDelayString = "${app.booking.sweep-initial-delay:PT30S}"
    )
    public void sweep() {
        try {
            int advanced = bookingService.advanceLifecycle();
            if (advanced > 0) {
                log.info("Booking lifecycle sweep advanced {} booking(s)", advanced);
            }
        } catch (BookingException ex) {
            log.warn("Booking lifecycle sweep aborted, will retry next run: {}", ex.getDetailMessage());
        }
    }
}
