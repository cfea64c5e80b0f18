package com.itms.backend.modules.booking.application;

import java.util.UUID;

import com.itms.backend.global.security.JwtAuthenticationPrincipal;
import com.itms.backend.modules.auth.application.AccessPolicy;
import com.itms.backend.modules.booking.domain.BookingActor;
import com.itms.backend.modules.booking.domain.BookingException;

import org.springframework.stereotype.Component;

/**
 * Maps an authenticated caller onto the actor kind the workflow understands. Callers holding the
 * approval capability act as APPROVER on any resource, everyone else as REQUESTER.
 */
@Component
public class BookingActorResolver {

    private final AccessPolicy accessPolicy;
    private final BookingStore bookingStore;

    public BookingActorResolver(AccessPolicy accessPolicy, BookingStore bookingStore) {
        this.accessPolicy = accessPolicy;
        this.bookingStore = bookingStore;
    }

    public BookingActor resolve(JwtAuthenticationPrincipal principal, UUID bookingId) {
        if (bookingStore.findResourceIdOf(bookingId).isEmpty()) {
            throw BookingException.bookingNotFound(bookingId);
        }
        if (accessPolicy.mayApproveBookings(principal)) {
            return BookingActor.approver(principal.userId());
        }
        return BookingActor.requester(principal.userId());
    }
}
