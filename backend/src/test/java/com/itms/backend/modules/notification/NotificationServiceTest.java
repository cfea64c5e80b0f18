package com.itms.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.itms.backend.modules.auth.domain.AccessRole;
import com.itms.backend.modules.auth.domain.AppUser;
import com.itms.backend.modules.auth.domain.AppUserStatus;
import com.itms.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.itms.backend.modules.notification.application.NotificationDraft;
import com.itms.backend.modules.notification.application.NotificationService;
import com.itms.backend.modules.notification.domain.Notification;
import com.itms.backend.modules.notification.domain.NotificationState;
import com.itms.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private AppUserRepository appUserRepository;

    private NotificationService notificationService;
    private AppUser targetUser;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        notificationService = new NotificationService(notificationRepository, appUserRepository, clock);

        targetUser = new AppUser();
        ReflectionTestUtils.setField(targetUser, "id", UUID.fromString("00000000-0000-0000-0000-000000000101"));
        targetUser.setLoginId("alice");
        targetUser.setPasswordHash("hash");
        targetUser.setFullName("Alice");
        targetUser.setEmail("alice@example.com");
        targetUser.setRole(AccessRole.USER);
        targetUser.setStatus(AppUserStatus.ACTIVE);
    }

    @Test
    void deliverCreatesUnreadWithTtl() {
        when(appUserRepository.findById(targetUser.getId())).thenReturn(Optional.of(targetUser));
        when(notificationRepository.existsByUserIdAndDedupeKey(targetUser.getId(), "BOOKING_APPROVED:1")).thenReturn(false);

        Optional<Notification> sent = notificationService.deliver(targetUser.getId(), new NotificationDraft(
                "BOOKING_APPROVED", "[예약] 승인됨", "room-1", "BOOKING_APPROVED:1", Map.of("bookingId", "1"), 24, null));

        assertThat(sent).isPresent();
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(captor.capture());
        Notification saved = captor.getValue();
        assertThat(saved.getUser()).isSameAs(targetUser);
        assertThat(saved.getState()).isEqualTo(NotificationState.UNREAD);
        assertThat(saved.getTtlAt()).isEqualTo(NOW.plusHours(24));
        assertThat(saved.getMetadata()).containsEntry("bookingId", "1");
    }

    @Test
    void duplicateDedupeKeyIsSkipped() {
        when(appUserRepository.findById(targetUser.getId())).thenReturn(Optional.of(targetUser));
        when(notificationRepository.existsByUserIdAndDedupeKey(targetUser.getId(), "KEY")).thenReturn(true);

        Optional<Notification> sent = notificationService.deliver(targetUser.getId(),
                draft("KEY"));

        assertThat(sent).isEmpty();
        verify(notificationRepository, never()).save(any());
    }

    @Test
    void inactiveUserReceivesNothing() {
        targetUser.setStatus(AppUserStatus.INACTIVE);
        when(appUserRepository.findById(targetUser.getId())).thenReturn(Optional.of(targetUser));

        assertThat(notificationService.deliver(targetUser.getId(), draft(null))).isEmpty();
        verify(notificationRepository, never()).save(any());
    }

    @Test
    void markReadRejectsExpiredNotification() {
        Notification expired = new Notification();
        expired.markExpired(NOW.minusHours(1));
        UUID notificationId = UUID.randomUUID();
        when(notificationRepository.findByIdAndUserId(notificationId, targetUser.getId())).thenReturn(Optional.of(expired));

        assertThatThrownBy(() -> notificationService.markNotificationRead(targetUser.getId(), notificationId))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("NOTIFICATION_EXPIRED");
    }

    @Test
    void markAllReadStampsEveryUnread() {
        Notification first = new Notification();
        Notification second = new Notification();
        when(notificationRepository.findByUserIdAndState(targetUser.getId(), NotificationState.UNREAD))
                .thenReturn(List.of(first, second));

        int updated = notificationService.markAllNotificationsRead(targetUser.getId());

        assertThat(updated).isEqualTo(2);
        assertThat(first.getState()).isEqualTo(NotificationState.READ);
        assertThat(second.getReadAt()).isEqualTo(NOW);
    }

    private static NotificationDraft draft(String dedupeKey) {
        return new NotificationDraft("BOOKING_APPROVED", "title", "body", dedupeKey, null, 24, null);
    }
}
