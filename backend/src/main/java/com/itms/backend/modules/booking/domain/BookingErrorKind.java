package com.itms.backend.modules.booking.domain;

import org.springframework.http.HttpStatus;

public enum BookingErrorKind {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_INTERVAL(HttpStatus.UNPROCESSABLE_ENTITY),
    RESOURCE_UNAVAILABLE(HttpStatus.CONFLICT),
    BOOKING_CONFLICT(HttpStatus.CONFLICT),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    BookingErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
