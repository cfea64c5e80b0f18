package com.itms.backend.modules.notification.application;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.itms.backend.modules.auth.domain.Capability;
import com.itms.backend.modules.auth.domain.CapabilityTable;
import com.itms.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.itms.backend.modules.booking.domain.BookingEventType;
import com.itms.backend.modules.booking.domain.BookingLifecycleEvent;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a committed booking lifecycle event into user notifications.
 *
 * <p>Runs in its own transaction so a failure here never touches the booking that triggered it.
 */
@Service
public class BookingNotificationService {

    static final String KIND_PREFIX = "BOOKING_";

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final NotificationService notificationService;
    private final AppUserRepository appUserRepository;
    private final int ttlHours;

    public BookingNotificationService(
            NotificationService notificationService,
            AppUserRepository appUserRepository,
            @Value("${app.notification.booking-ttl-hours:168}") int ttlHours
    ) {
        this.notificationService = notificationService;
        this.appUserRepository = appUserRepository;
        this.ttlHours = ttlHours;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int notify(BookingLifecycleEvent event) {
        Set<UUID> recipients = recipientsOf(event);
        String kindCode = kindOf(event.type());
        NotificationDraft draft = new NotificationDraft(
                kindCode,
                titleOf(event),
                bodyOf(event),
                kindCode + ":" + event.bookingId(),
                metadataOf(event),
                ttlHours,
                event.correlationId()
        );

        int sent = 0;
        for (UUID recipient : recipients) {
            if (notificationService.deliver(recipient, draft).isPresent()) {
                sent++;
            }
        }
        return sent;
    }

    Set<UUID> recipientsOf(BookingLifecycleEvent event) {
        Set<UUID> recipients = new LinkedHashSet<>();
        switch (event.type()) {
            case CREATED -> {
                recipients.addAll(appUserRepository.findActiveUserIdsByRoleIn(
                        CapabilityTable.rolesWith(Capability.APPROVE_BOOKING)));
                recipients.remove(event.requesterId());
            }
            case APPROVED, REJECTED -> recipients.add(event.requesterId());
            case CANCELLED -> {
                if (!event.requesterId().equals(event.actorUserId())) {
                    recipients.add(event.requesterId());
                }
            }
        }
        return recipients;
    }

    static String kindOf(BookingEventType type) {
        return KIND_PREFIX + type.name();
    }

    private String titleOf(BookingLifecycleEvent event) {
        return switch (event.type()) {
            case CREATED -> "[예약] 승인 요청";
            case APPROVED -> "[예약] 승인됨";
            case REJECTED -> "[예약] 반려됨";
            case CANCELLED -> "[예약] 취소됨";
        };
    }

    private String bodyOf(BookingLifecycleEvent event) {
        String resource = event.resourceName() != null ? event.resourceName() : String.valueOf(event.resourceId());
        StringBuilder body = new StringBuilder()
                .append(resource)
                .append(' ')
                .append(WINDOW_FORMAT.format(event.startTime()))
                .append(" ~ ")
                .append(WINDOW_FORMAT.format(event.endTime()));
        if (event.title() != null) {
            body.append(" · ").append(event.title());
        }
        if (event.note() != null) {
            body.append(" (").append(event.note()).append(')');
        }
        return body.toString();
    }

    private Map<String, Object> metadataOf(BookingLifecycleEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("bookingId", event.bookingId().toString());
        metadata.put("resourceId", event.resourceId().toString());
        metadata.put("eventType", event.type().name());
        if (event.actorUserId() != null) {
            metadata.put("actorUserId", event.actorUserId().toString());
        }
        return metadata;
    }
}
