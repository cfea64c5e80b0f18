package com.itms.backend.modules.booking.presentation;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.itms.backend.global.security.SecurityUtils;
import com.itms.backend.modules.booking.application.BookingService;
import com.itms.backend.modules.booking.presentation.dto.BookingDecisionRequest;
import com.itms.backend.modules.booking.presentation.dto.BookingHistoryEntryResponse;
import com.itms.backend.modules.booking.presentation.dto.BookingResponse;
import com.itms.backend.modules.booking.presentation.dto.CalendarEntryResponse;
import com.itms.backend.modules.booking.presentation.dto.CreateBookingRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/bookings")
@Tag(name = "Bookings")
public class BookingController {

    private final BookingService bookingService;

    public BookingController(BookingService bookingService) {
        this.bookingService = bookingService;
    }

    @Operation(summary = "Request a booking; it starts PENDING")
    @PostMapping
    public ResponseEntity<BookingResponse> createBooking(@Valid @RequestBody CreateBookingRequest request) {
        BookingResponse created = bookingService.createBooking(request, SecurityUtils.getCurrentPrincipal());
        return ResponseEntity.created(URI.create("/bookings/" + created.id())).body(created);
    }

    @GetMapping
    public ResponseEntity<List<BookingResponse>> searchBookings(
            @RequestParam(name = "resourceId", required = false) UUID resourceId,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "mine", defaultValue = "false") boolean mine
    ) {
        return ResponseEntity.ok(bookingService.searchBookings(resourceId, status, mine, SecurityUtils.getCurrentPrincipal()));
    }

    @Operation(summary = "Bookings overlapping a window, across resources or for one")
    @GetMapping("/calendar")
    public ResponseEntity<List<CalendarEntryResponse>> calendar(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime end,
            @RequestParam(name = "resourceId", required = false) UUID resourceId
    ) {
        return ResponseEntity.ok(bookingService.calendar(start, end, resourceId));
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingResponse> getBooking(@PathVariable("bookingId") UUID bookingId) {
        return ResponseEntity.ok(bookingService.getBooking(bookingId, SecurityUtils.getCurrentPrincipal()));
    }

    @GetMapping("/{bookingId}/history")
    public ResponseEntity<List<BookingHistoryEntryResponse>> history(@PathVariable("bookingId") UUID bookingId) {
        return ResponseEntity.ok(bookingService.history(bookingId, SecurityUtils.getCurrentPrincipal()));
    }

    @PostMapping("/{bookingId}/approve")
    public ResponseEntity<BookingResponse> approve(
            @PathVariable("bookingId") UUID bookingId,
            @Valid @RequestBody(required = false) BookingDecisionRequest request
    ) {
        return ResponseEntity.ok(bookingService.approve(bookingId, noteOf(request), SecurityUtils.getCurrentPrincipal()));
    }

    @PostMapping("/{bookingId}/reject")
    public ResponseEntity<BookingResponse> reject(
            @PathVariable("bookingId") UUID bookingId,
            @Valid @RequestBody(required = false) BookingDecisionRequest request
    ) {
        return ResponseEntity.ok(bookingService.reject(bookingId, noteOf(request), SecurityUtils.getCurrentPrincipal()));
    }

    @Operation(summary = "Confirm an approved booking before it starts")
    @PostMapping("/{bookingId}/confirm")
    public ResponseEntity<BookingResponse> confirm(
            @PathVariable("bookingId") UUID bookingId,
            @Valid @RequestBody(required = false) BookingDecisionRequest request
    ) {
        return ResponseEntity.ok(bookingService.confirm(bookingId, noteOf(request), SecurityUtils.getCurrentPrincipal()));
    }

    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<BookingResponse> cancel(
            @PathVariable("bookingId") UUID bookingId,
            @Valid @RequestBody(required = false) BookingDecisionRequest request
    ) {
        return ResponseEntity.ok(bookingService.cancel(bookingId, noteOf(request), SecurityUtils.getCurrentPrincipal()));
    }

    private String noteOf(BookingDecisionRequest request) {
        if (request == null || request.note() == null || request.note().isBlank()) {
            return null;
        }
        return request.note().trim();
    }
}
