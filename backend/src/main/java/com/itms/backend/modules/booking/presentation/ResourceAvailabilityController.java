package com.itms.backend.modules.booking.presentation;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.itms.backend.global.security.SecurityUtils;
import com.itms.backend.modules.booking.application.BookingService;
import com.itms.backend.modules.booking.presentation.dto.AvailabilityResponse;
import com.itms.backend.modules.booking.presentation.dto.BookingResponse;
import com.itms.backend.modules.booking.presentation.dto.FreeBusyResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/resources/{resourceId}")
@Tag(name = "Resource availability")
public class ResourceAvailabilityController {

    private final BookingService bookingService;

    public ResourceAvailabilityController(BookingService bookingService) {
        this.bookingService = bookingService;
    }

    @Operation(summary = "Whether the resource can take a new booking for the interval")
    @GetMapping("/availability")
    public ResponseEntity<AvailabilityResponse> availability(
            @PathVariable("resourceId") UUID resourceId,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime end
    ) {
        return ResponseEntity.ok(bookingService.checkAvailability(resourceId, start, end));
    }

    @Operation(summary = "Busy and free slots covering the whole range")
    @GetMapping("/free-busy")
    public ResponseEntity<FreeBusyResponse> freeBusy(
            @PathVariable("resourceId") UUID resourceId,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime end
    ) {
        return ResponseEntity.ok(bookingService.freeBusy(resourceId, start, end));
    }

    @Operation(summary = "Bookings on the resource ordered by start; plain users see only their own")
    @GetMapping("/bookings")
    public ResponseEntity<List<BookingResponse>> bookings(
            @PathVariable("resourceId") UUID resourceId,
            @RequestParam(name = "status", required = false) String status
    ) {
        return ResponseEntity.ok(bookingService.listForResource(resourceId, status, SecurityUtils.getCurrentPrincipal()));
    }
}
