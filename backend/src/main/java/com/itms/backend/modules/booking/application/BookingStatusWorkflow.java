package com.itms.backend.modules.booking.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.itms.backend.modules.booking.domain.ActorKind;
import com.itms.backend.modules.booking.domain.Booking;
import com.itms.backend.modules.booking.domain.BookingActor;
import com.itms.backend.modules.booking.domain.BookingException;
import com.itms.backend.modules.booking.domain.BookingStatus;
import com.itms.backend.modules.booking.domain.BookingTransition;

import org.springframework.stereotype.Component;

/**
 * Legal status graph of a booking and the only writer of {@link Booking#getStatus()}.
 *
 * <p>A request is checked in a fixed order: the edge must exist ({@code INVALID_TRANSITION}), the actor kind
 * must be allowed to trigger it ({@code UNAUTHORIZED}), then the guard must hold ({@code INVALID_TRANSITION},
 * or {@code BOOKING_CONFLICT} for the approval re-check). The read-check-write runs under the resource lock.
 */
@Component
public class BookingStatusWorkflow {

    enum Guard {
        NONE,
        NO_CONFLICT,
        NOW_AT_OR_BEFORE_START,
        NOW_BEFORE_START,
        NOW_AT_OR_AFTER_START,
        NOW_AT_OR_AFTER_END
    }

    record TransitionRule(BookingStatus from, BookingStatus to, Set<ActorKind> triggers, Guard guard) {
    }

    private static final Map<BookingStatus, Map<BookingStatus, TransitionRule>> RULES = new EnumMap<>(BookingStatus.class);

    static {
        Set<ActorKind> approver = EnumSet.of(ActorKind.APPROVER);
        Set<ActorKind> requesterOrApprover = EnumSet.of(ActorKind.REQUESTER, ActorKind.APPROVER);
        Set<ActorKind> approverOrSystem = EnumSet.of(ActorKind.APPROVER, ActorKind.SYSTEM);
        Set<ActorKind> system = EnumSet.of(ActorKind.SYSTEM);

        rule(BookingStatus.PENDING, BookingStatus.APPROVED, approver, Guard.NO_CONFLICT);
        rule(BookingStatus.PENDING, BookingStatus.REJECTED, approver, Guard.NONE);
        rule(BookingStatus.PENDING, BookingStatus.CANCELLED, requesterOrApprover, Guard.NONE);
        rule(BookingStatus.APPROVED, BookingStatus.CONFIRMED, approverOrSystem, Guard.NOW_AT_OR_BEFORE_START);
        rule(BookingStatus.APPROVED, BookingStatus.CANCELLED, requesterOrApprover, Guard.NOW_BEFORE_START);
        rule(BookingStatus.CONFIRMED, BookingStatus.IN_USE, system, Guard.NOW_AT_OR_AFTER_START);
        rule(BookingStatus.CONFIRMED, BookingStatus.CANCELLED, requesterOrApprover, Guard.NOW_BEFORE_START);
        rule(BookingStatus.IN_USE, BookingStatus.COMPLETED, system, Guard.NOW_AT_OR_AFTER_END);
    }

    private static void rule(BookingStatus from, BookingStatus to, Set<ActorKind> triggers, Guard guard) {
        RULES.computeIfAbsent(from, key -> new EnumMap<>(BookingStatus.class))
                .put(to, new TransitionRule(from, to, Collections.unmodifiableSet(triggers), guard));
    }

    private final BookingStore bookingStore;
    private final ConflictDetector conflictDetector;
    private final ResourceLock resourceLock;
    private final Clock clock;

    public BookingStatusWorkflow(
            BookingStore bookingStore,
            ConflictDetector conflictDetector,
            ResourceLock resourceLock,
            Clock clock
    ) {
        this.bookingStore = bookingStore;
        this.conflictDetector = conflictDetector;
        this.resourceLock = resourceLock;
        this.clock = clock;
    }

    public BookingTransition transition(UUID bookingId, BookingStatus target, BookingActor actor, String note) {
        UUID resourceId = bookingStore.findResourceIdOf(bookingId)
                .orElseThrow(() -> BookingException.bookingNotFound(bookingId));
        return resourceLock.withLock(resourceId, () -> {
            Booking booking = bookingStore.findById(bookingId)
                    .orElseThrow(() -> BookingException.bookingNotFound(bookingId));
            BookingStatus from = booking.getStatus();
            TransitionRule rule = ruleFor(from, target);
            authorize(rule, booking, actor);
            OffsetDateTime now = OffsetDateTime.now(clock);
            checkGuard(rule, booking, now);

            booking.applyTransition(target, actor, note, now);
            Booking saved = bookingStore.save(booking);
            return new BookingTransition(saved, from, target, actor, note);
        });
    }

    public static boolean isLegal(BookingStatus from, BookingStatus to) {
        return RULES.getOrDefault(from, Map.of()).containsKey(to);
    }

    public static Set<BookingStatus> legalTargets(BookingStatus from) {
        Map<BookingStatus, TransitionRule> targets = RULES.get(from);
        return targets == null ? Set.of() : Collections.unmodifiableSet(targets.keySet());
    }

    private TransitionRule ruleFor(BookingStatus from, BookingStatus to) {
        TransitionRule rule = RULES.getOrDefault(from, Map.of()).get(to);
        if (rule == null) {
            throw BookingException.invalidTransition(from, to, "not a legal transition");
        }
        return rule;
    }

    private void authorize(TransitionRule rule, Booking booking, BookingActor actor) {
        if (!rule.triggers().contains(actor.kind())) {
            String code;
            if (rule.triggers().equals(EnumSet.of(ActorKind.APPROVER))) {
                code = "APPROVER_ONLY";
            } else if (rule.triggers().equals(EnumSet.of(ActorKind.SYSTEM))) {
                code = "SYSTEM_ONLY";
            } else {
                code = "UNAUTHORIZED_TRANSITION";
            }
            throw BookingException.unauthorized(code,
                    actor.kind() + " may not move a booking from " + rule.from() + " to " + rule.to());
        }
        if (actor.kind() == ActorKind.REQUESTER && !booking.getRequesterId().equals(actor.userId())) {
            throw BookingException.unauthorized("NOT_BOOKING_OWNER", "only the requester may act on this booking");
        }
    }

    private void checkGuard(TransitionRule rule, Booking booking, OffsetDateTime now) {
        OffsetDateTime start = booking.getStartTime();
        OffsetDateTime end = booking.getEndTime();
        switch (rule.guard()) {
            case NONE -> {
            }
            case NO_CONFLICT -> {
                if (conflictDetector.hasConflict(booking.getResourceId(), booking.getInterval(), booking.getId())) {
                    throw BookingException.conflict(booking.getResourceId());
                }
            }
            case NOW_AT_OR_BEFORE_START -> {
                if (now.isAfter(start)) {
                    throw BookingException.invalidTransition(rule.from(), rule.to(), "booking has already started");
                }
            }
            case NOW_BEFORE_START -> {
                if (!now.isBefore(start)) {
                    throw BookingException.invalidTransition(rule.from(), rule.to(), "booking has already started");
                }
            }
            case NOW_AT_OR_AFTER_START -> {
                if (now.isBefore(start)) {
                    throw BookingException.invalidTransition(rule.from(), rule.to(), "booking has not started yet");
                }
            }
            case NOW_AT_OR_AFTER_END -> {
                if (now.isBefore(end)) {
                    throw BookingException.invalidTransition(rule.from(), rule.to(), "booking has not ended yet");
                }
            }
        }
    }
}
