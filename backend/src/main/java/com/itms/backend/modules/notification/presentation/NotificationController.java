package com.itms.backend.modules.notification.presentation;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.itms.backend.global.security.SecurityUtils;
import com.itms.backend.modules.notification.application.NotificationService;
import com.itms.backend.modules.notification.application.NotificationService.NotificationFilterState;
import com.itms.backend.modules.notification.application.NotificationService.NotificationPageResult;
import com.itms.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.itms.backend.modules.notification.presentation.dto.NotificationListResponse;

import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/notifications")
@Tag(name = "Notifications")
public class NotificationController {

    private static final int MAX_PAGE_SIZE = 50;

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @RequestParam(name = "state", defaultValue = "all") String stateParam,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        NotificationFilterState filter = parseState(stateParam);
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);

        UUID userId = SecurityUtils.getCurrentUserId();
        NotificationPageResult result = notificationService.getNotifications(
                userId,
                filter,
                PageRequest.of(safePage, safeSize)
        );

        List<NotificationItemResponse> items = result.notifications().stream()
                .map(NotificationItemResponse::from)
                .toList();

        return ResponseEntity.ok(new NotificationListResponse(
                items,
                result.page(),
                result.size(),
                result.totalElements(),
                result.unreadCount()
        ));
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(@PathVariable("notificationId") UUID notificationId) {
        notificationService.markNotificationRead(SecurityUtils.getCurrentUserId(), notificationId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/read-all")
    public ResponseEntity<Void> markAllRead() {
        notificationService.markAllNotificationsRead(SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    private NotificationFilterState parseState(String value) {
        String normalized = value == null ? "all" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "all" -> NotificationFilterState.ALL;
            case "unread" -> NotificationFilterState.UNREAD;
            case "read" -> NotificationFilterState.READ;
            default -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_STATE");
        };
    }
}
