package com.itms.backend.modules.booking.domain;

import java.util.UUID;

import com.itms.backend.global.error.RetryableProblemException;

/**
 * Typed failure of a booking engine operation. Only {@link BookingErrorKind#STORE_UNAVAILABLE}
 * carries a non-zero retry-after hint.
 */
public class BookingException extends RetryableProblemException {

    static final int STORE_RETRY_AFTER_SECONDS = 1;

    private final BookingErrorKind kind;

    public BookingException(BookingErrorKind kind, String code, String detail) {
        this(kind, code, detail, 0, null);
    }

    private BookingException(BookingErrorKind kind, String code, String detail, int retryAfterSeconds,
                             Throwable cause) {
        super(kind.httpStatus(), code, detail, retryAfterSeconds, cause);
        this.kind = kind;
    }

    public BookingErrorKind getKind() {
        return kind;
    }

    public static BookingException resourceNotFound(UUID resourceId) {
        return new BookingException(BookingErrorKind.NOT_FOUND, "RESOURCE_NOT_FOUND",
                "resource " + resourceId + " does not exist");
    }

    public static BookingException bookingNotFound(UUID bookingId) {
        return new BookingException(BookingErrorKind.NOT_FOUND, "BOOKING_NOT_FOUND",
                "booking " + bookingId + " does not exist");
    }

    public static BookingException invalidInterval(String detail) {
        return new BookingException(BookingErrorKind.INVALID_INTERVAL, "INVALID_INTERVAL", detail);
    }

    public static BookingException resourceUnavailable(UUID resourceId, String status) {
        return new BookingException(BookingErrorKind.RESOURCE_UNAVAILABLE, "RESOURCE_UNAVAILABLE",
                "resource " + resourceId + " is " + status + " and accepts no new bookings");
    }

    public static BookingException conflict(UUID resourceId) {
        return new BookingException(BookingErrorKind.BOOKING_CONFLICT, "BOOKING_CONFLICT",
                "requested interval overlaps an active booking on resource " + resourceId);
    }

    public static BookingException invalidTransition(BookingStatus from, BookingStatus to, String reason) {
        return new BookingException(BookingErrorKind.INVALID_TRANSITION, "INVALID_TRANSITION",
                from + " -> " + to + ": " + reason);
    }

    public static BookingException unauthorized(String code, String detail) {
        return new BookingException(BookingErrorKind.UNAUTHORIZED, code, detail);
    }

    public static BookingException storeUnavailable(String detail, Throwable cause) {
        return new BookingException(BookingErrorKind.STORE_UNAVAILABLE, "STORE_UNAVAILABLE",
                detail, STORE_RETRY_AFTER_SECONDS, cause);
    }
}
