package com.itms.backend.modules.booking.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.itms.backend.global.security.JwtAuthenticationPrincipal;
import com.itms.backend.global.web.RequestIdFilter;
import com.itms.backend.modules.audit.application.AuditLogService;
import com.itms.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.itms.backend.modules.auth.application.AccessPolicy;
import com.itms.backend.modules.auth.domain.Capability;
import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingActor;
import com.itms.backend.modules.booking.domain.BookingDetails;
import com.itms.backend.modules.booking.domain.BookingErrorKind;
import com.itms.backend.modules.booking.domain.BookingEventType;
import com.itms.backend.modules.booking.domain.BookingException;
import com.itms.backend.modules.booking.domain.BookingLifecycleEvent;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.domain.BookingTransition;
import com.itms.backend.modules.booking.domain.FreeBusySlot;
import com.itms.backend.modules.booking.domain.TimeInterval;
import com.itms.backend.modules.booking.presentation.dto.AvailabilityResponse;
import com.itms.backend.modules.booking.presentation.dto.BookingHistoryEntryResponse;
import com.itms.backend.modules.booking.presentation.dto.BookingResponse;
import com.itms.backend.modules.booking.presentation.dto.CalendarEntryResponse;
import com.itms.backend.modules.booking.presentation.dto.CreateBookingRequest;
import com.itms.backend.modules.booking.presentation.dto.FreeBusyResponse;
import com.itms.backend.modules.resource.application.ResourceRegistry;
import com.itms.backend.modules.resource.domain.BookableResource;
import com.itms.backend.modules.resource.infrastructure.persistence.BookableResourceRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Transactional entry point of the booking engine for the HTTP layer and the lifecycle sweep.
 * Every write runs in one transaction that also records the audit entry and publishes the
 * {@link BookingLifecycleEvent} delivered after commit.
 */
@Service
@Transactional
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    static final Set<BookingStatus> CALENDAR_STATUSES = EnumSet.of(
            BookingStatus.PENDING,
            BookingStatus.APPROVED,
            BookingStatus.CONFIRMED,
            BookingStatus.IN_USE,
            BookingStatus.COMPLETED
    );
    private static final long MAX_RANGE_DAYS = 92;

    private final BookingLedger bookingLedger;
    private final BookingStatusWorkflow statusWorkflow;
    private final AvailabilityQuery availabilityQuery;
    private final BookingStore bookingStore;
    private final BookingActorResolver actorResolver;
    private final ResourceRegistry resourceRegistry;
    private final BookableResourceRepository resourceRepository;
    private final AccessPolicy accessPolicy;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public BookingService(
            BookingLedger bookingLedger,
            BookingStatusWorkflow statusWorkflow,
            AvailabilityQuery availabilityQuery,
            BookingStore bookingStore,
            BookingActorResolver actorResolver,
            ResourceRegistry resourceRegistry,
            BookableResourceRepository resourceRepository,
            AccessPolicy accessPolicy,
            AuditLogService auditLogService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.bookingLedger = bookingLedger;
        this.statusWorkflow = statusWorkflow;
        this.availabilityQuery = availabilityQuery;
        this.bookingStore = bookingStore;
        this.actorResolver = actorResolver;
        this.resourceRegistry = resourceRegistry;
        this.resourceRepository = resourceRepository;
        this.accessPolicy = accessPolicy;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public BookingResponse createBooking(CreateBookingRequest request, JwtAuthenticationPrincipal principal) {
        TimeInterval interval = TimeInterval.of(request.startTime(), request.endTime());
        BookingDetails details = new BookingDetails(
                request.title().trim(),
                request.purpose(),
                request.attendees(),
                request.contactInfo(),
                request.specialRequirements()
        );
        Booking booking = bookingLedger.create(request.resourceId(), principal.userId(), interval, details);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("bookingNumber", booking.getBookingNumber());
        detail.put("resourceId", booking.getResourceId().toString());
        detail.put("startTime", booking.getStartTime().toString());
        detail.put("endTime", booking.getEndTime().toString());
        detail.put("status", booking.getStatus().name());
        audit("BOOKING_CREATED", booking.getId(), principal.userId(), detail);
        publish(BookingEventType.CREATED, booking, principal.userId(), null);
        return BookingResponse.from(booking);
    }

    @Transactional(readOnly = true)
    public BookingResponse getBooking(UUID bookingId, JwtAuthenticationPrincipal principal) {
        Booking booking = bookingLedger.get(bookingId);
        ensureVisible(booking, principal);
        return BookingResponse.from(booking);
    }

    /**
     * Callers without approval or reporting rights only ever see their own bookings.
     */
    @Transactional(readOnly = true)
    public List<BookingResponse> searchBookings(UUID resourceId, String status, boolean mine,
                                                JwtAuthenticationPrincipal principal) {
        UUID requesterFilter = mine || !canSeeAllBookings(principal) ? principal.userId() : null;
        BookingSearchCriteria criteria = new BookingSearchCriteria(resourceId, requesterFilter, parseStatus(status));
        return bookingStore.search(criteria).stream()
                .map(BookingResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> listForResource(UUID resourceId, String status, JwtAuthenticationPrincipal principal) {
        BookingStatus filter = parseStatus(status);
        Set<BookingStatus> statuses = filter == null ? Set.of() : EnumSet.of(filter);
        boolean seesAll = canSeeAllBookings(principal);
        return bookingLedger.listForResource(resourceId, statuses).stream()
                .filter(booking -> seesAll || booking.getRequesterId().equals(principal.userId()))
                .map(BookingResponse::from)
                .toList();
    }

    public BookingResponse approve(UUID bookingId, String note, JwtAuthenticationPrincipal principal) {
        return decide(bookingId, BookingStatus.APPROVED, note, principal);
    }

    public BookingResponse reject(UUID bookingId, String note, JwtAuthenticationPrincipal principal) {
        return decide(bookingId, BookingStatus.REJECTED, note, principal);
    }

    public BookingResponse confirm(UUID bookingId, String note, JwtAuthenticationPrincipal principal) {
        return decide(bookingId, BookingStatus.CONFIRMED, note, principal);
    }

    public BookingResponse cancel(UUID bookingId, String note, JwtAuthenticationPrincipal principal) {
        BookingActor actor = actorResolver.resolve(principal, bookingId);
        BookingTransition transition = bookingLedger.cancel(bookingId, actor, note);
        afterTransition(transition);
        return BookingResponse.from(transition.booking());
    }

    @Transactional(readOnly = true)
    public AvailabilityResponse checkAvailability(UUID resourceId, OffsetDateTime start, OffsetDateTime end) {
        TimeInterval interval = TimeInterval.of(start, end);
        boolean free = availabilityQuery.isFree(resourceId, interval);
        return new AvailabilityResponse(resourceId, interval.start(), interval.end(), free);
    }

    @Transactional(readOnly = true)
    public FreeBusyResponse freeBusy(UUID resourceId, OffsetDateTime start, OffsetDateTime end) {
        TimeInterval range = boundedRange(start, end);
        BookableResource resource = resourceRegistry.getResource(resourceId);
        List<FreeBusyResponse.Slot> slots = availabilityQuery.freeBusyIntervals(resourceId, range).stream()
                .map(this::toSlot)
                .toList();
        return new FreeBusyResponse(resourceId, range.start(), range.end(), resourceRegistry.isBookable(resource), slots);
    }

    @Transactional(readOnly = true)
    public List<CalendarEntryResponse> calendar(OffsetDateTime start, OffsetDateTime end, UUID resourceId) {
        TimeInterval range = boundedRange(start, end);
        if (resourceId != null) {
            resourceRegistry.getResource(resourceId);
        }
        List<Booking> bookings = bookingStore.findOverlapping(resourceId, range, CALENDAR_STATUSES);
        Set<UUID> resourceIds = bookings.stream().map(Booking::getResourceId).collect(Collectors.toSet());
        Map<UUID, String> names = resourceRepository.findAllById(resourceIds).stream()
                .collect(Collectors.toMap(BookableResource::getId, BookableResource::getName));
        return bookings.stream()
                .map(booking -> new CalendarEntryResponse(
                        booking.getId(),
                        booking.getResourceId(),
                        names.get(booking.getResourceId()),
                        booking.getDetails() != null ? booking.getDetails().getTitle() : null,
                        booking.getStartTime(),
                        booking.getEndTime(),
                        booking.getStatus().name(),
                        booking.getRequesterId()
                ))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<BookingHistoryEntryResponse> history(UUID bookingId, JwtAuthenticationPrincipal principal) {
        Booking booking = bookingLedger.get(bookingId);
        ensureVisible(booking, principal);
        return auditLogService.history(AuditLogService.RESOURCE_TYPE_BOOKING, bookingId.toString()).stream()
                .map(entry -> new BookingHistoryEntryResponse(
                        entry.getActionType(),
                        entry.getActorUserId(),
                        entry.getCreatedAt(),
                        entry.getDetail()
                ))
                .toList();
    }

    /**
     * Time-driven transitions: CONFIRMED bookings whose start has passed go IN_USE, then IN_USE
     * bookings whose end has passed go COMPLETED. A booking may take both steps in one sweep.
     */
    public int advanceLifecycle() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int advanced = 0;
        for (Booking booking : bookingStore.findByStatusStartingAtOrBefore(BookingStatus.CONFIRMED, now)) {
            advanced += advance(booking.getId(), BookingStatus.IN_USE);
        }
        for (Booking booking : bookingStore.findByStatusEndingAtOrBefore(BookingStatus.IN_USE, now)) {
            advanced += advance(booking.getId(), BookingStatus.COMPLETED);
        }
        return advanced;
    }

    private int advance(UUID bookingId, BookingStatus target) {
        try {
            afterTransition(statusWorkflow.transition(bookingId, target, BookingActor.system(), null));
            return 1;
        } catch (BookingException ex) {
            if (ex.getKind() == BookingErrorKind.STORE_UNAVAILABLE) {
                throw ex;
            }
            log.warn("Skipped lifecycle step of booking {} to {}: {}", bookingId, target, ex.getDetailMessage());
            return 0;
        }
    }

    private BookingResponse decide(UUID bookingId, BookingStatus target, String note,
                                   JwtAuthenticationPrincipal principal) {
        BookingActor actor = actorResolver.resolve(principal, bookingId);
        BookingTransition transition = statusWorkflow.transition(bookingId, target, actor, note);
        afterTransition(transition);
        return BookingResponse.from(transition.booking());
    }

    private void afterTransition(BookingTransition transition) {
        Booking booking = transition.booking();
        UUID actorUserId = transition.actor().userId();
        log.info("Booking {} {} -> {} by {}", booking.getId(), transition.from(), transition.to(),
                transition.actor().kind());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("from", transition.from().name());
        detail.put("to", transition.to().name());
        detail.put("actorKind", transition.actor().kind().name());
        if (transition.note() != null) {
            detail.put("note", transition.note());
        }
        audit("BOOKING_" + transition.to().name(), booking.getId(), actorUserId, detail);

        BookingEventType eventType = switch (transition.to()) {
            case APPROVED -> BookingEventType.APPROVED;
            case REJECTED -> BookingEventType.REJECTED;
            case CANCELLED -> BookingEventType.CANCELLED;
            default -> null;
        };
        if (eventType != null) {
            publish(eventType, booking, actorUserId, transition.note());
        }
    }

    private void publish(BookingEventType type, Booking booking, UUID actorUserId, String note) {
        String resourceName = resourceRepository.findById(booking.getResourceId())
                .map(BookableResource::getName)
                .orElse(null);
        eventPublisher.publishEvent(new BookingLifecycleEvent(
                type,
                booking.getId(),
                booking.getResourceId(),
                resourceName,
                booking.getRequesterId(),
                actorUserId,
                booking.getDetails() != null ? booking.getDetails().getTitle() : null,
                booking.getStartTime(),
                booking.getEndTime(),
                note,
                RequestIdFilter.currentCorrelationId()
        ));
    }

    private void audit(String actionType, UUID bookingId, UUID actorUserId, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(
                actionType,
                AuditLogService.RESOURCE_TYPE_BOOKING,
                bookingId.toString(),
                actorUserId,
                RequestIdFilter.currentCorrelationId(),
                detail
        ));
    }

    private void ensureVisible(Booking booking, JwtAuthenticationPrincipal principal) {
        if (!booking.getRequesterId().equals(principal.userId()) && !canSeeAllBookings(principal)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "BOOKING_ACCESS_DENIED");
        }
    }

    private boolean canSeeAllBookings(JwtAuthenticationPrincipal principal) {
        return accessPolicy.hasCapability(principal, Capability.APPROVE_BOOKING)
                || accessPolicy.hasCapability(principal, Capability.VIEW_REPORTS);
    }

    private TimeInterval boundedRange(OffsetDateTime start, OffsetDateTime end) {
        TimeInterval range = TimeInterval.of(start, end);
        if (range.duration().toDays() > MAX_RANGE_DAYS) {
            throw BookingException.invalidInterval("range must not exceed " + MAX_RANGE_DAYS + " days");
        }
        return range;
    }

    private FreeBusyResponse.Slot toSlot(FreeBusySlot slot) {
        return new FreeBusyResponse.Slot(slot.interval().start(), slot.interval().end(), slot.busy());
    }

    private BookingStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return BookingStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_STATUS");
        }
    }
}
