package com.itms.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.itms.backend.modules.auth.domain.AppUser;
import com.itms.backend.modules.auth.domain.AppUserStatus;
import com.itms.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.itms.backend.modules.notification.domain.Notification;
import com.itms.backend.modules.notification.domain.NotificationState;
import com.itms.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public NotificationService(
            NotificationRepository notificationRepository,
            AppUserRepository appUserRepository,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    public NotificationPageResult getNotifications(UUID userId, NotificationFilterState filter, Pageable pageable) {
        expireNotifications(userId);

        List<NotificationState> states = switch (filter) {
            case ALL -> List.of(NotificationState.UNREAD, NotificationState.READ);
            case UNREAD -> List.of(NotificationState.UNREAD);
            case READ -> List.of(NotificationState.READ);
        };

        Page<Notification> page = notificationRepository.findByUserIdAndStates(userId, states, pageable);
        long unreadCount = notificationRepository.countByUserIdAndState(userId, NotificationState.UNREAD);

        return new NotificationPageResult(
                page.getContent(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                unreadCount
        );
    }

    public void markNotificationRead(UUID userId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "NOTIFICATION_NOT_FOUND"));

        if (notification.getState() == NotificationState.EXPIRED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "NOTIFICATION_EXPIRED");
        }

        if (notification.getState() == NotificationState.UNREAD) {
            notification.markRead(OffsetDateTime.now(clock));
            notificationRepository.save(notification);
        }
    }

    public int markAllNotificationsRead(UUID userId) {
        List<Notification> unread = notificationRepository.findByUserIdAndState(userId, NotificationState.UNREAD);
        if (unread.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        unread.forEach(notification -> notification.markRead(now));
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    /**
     * Addresses {@code draft} to one user. Inactive users and users already holding the draft's dedupe key
     * receive nothing.
     */
    public Optional<Notification> deliver(UUID userId, NotificationDraft draft) {
        AppUser recipient = appUserRepository.findById(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        if (recipient.getStatus() != AppUserStatus.ACTIVE) {
            return Optional.empty();
        }
        if (draft.dedupeKey() != null && notificationRepository.existsByUserIdAndDedupeKey(userId, draft.dedupeKey())) {
            return Optional.empty();
        }
        Notification notification = Notification.unread(recipient, draft.kindCode(), draft.title(), draft.body(),
                OffsetDateTime.now(clock).plusHours(draft.ttlHours()));
        notification.setDedupeKey(draft.dedupeKey());
        notification.setMetadata(draft.metadata());
        notification.setCorrelationId(draft.correlationId());
        notificationRepository.save(notification);
        return Optional.of(notification);
    }

    private void expireNotifications(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Notification> expirable = notificationRepository.findByUserIdAndTtlAtBeforeAndStateNot(
                userId,
                now,
                NotificationState.EXPIRED
        );
        if (expirable.isEmpty()) {
            return;
        }
        expirable.forEach(notification -> notification.markExpired(now));
        notificationRepository.saveAll(expirable);
    }

    public enum NotificationFilterState {
        ALL,
        UNREAD,
        READ
    }

    public record NotificationPageResult(
            List<Notification> notifications,
            int page,
            int size,
            long totalElements,
            long unreadCount
    ) {
    }
}
