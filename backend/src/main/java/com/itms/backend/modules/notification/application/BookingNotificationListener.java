package com.itms.backend.modules.notification.application;

import com.itms.backend.modules.booking.domain.BookingLifecycleEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers booking notifications once the booking change is committed. Delivery failures are logged only.
 */
@Component
public class BookingNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(BookingNotificationListener.class);

    private final BookingNotificationService bookingNotificationService;

    public BookingNotificationListener(BookingNotificationService bookingNotificationService) {
        this.bookingNotificationService = bookingNotificationService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBookingEvent(BookingLifecycleEvent event) {
        try {
            int sent = bookingNotificationService.notify(event);
            log.debug("Booking {} {} produced {} notification(s)", event.bookingId(), event.type(), sent);
        } catch (RuntimeException ex) {
            log.warn("Failed to deliver {} notifications for booking {}", event.type(), event.bookingId(), ex);
        }
    }
}
