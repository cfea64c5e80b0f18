package com.itms.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.itms.backend.modules.notification.domain.Notification;

public record NotificationItemResponse(
        UUID id,
        String kindCode,
        String title,
        String body,
        String state,
        OffsetDateTime createdAt,
        OffsetDateTime readAt,
        OffsetDateTime ttlAt,
        UUID correlationId,
        Map<String, Object> metadata
) {

    public static NotificationItemResponse from(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getKindCode(),
                notification.getTitle(),
                notification.getBody(),
                notification.getState().name(),
                notification.getCreatedAt(),
                notification.getReadAt(),
                notification.getTtlAt(),
                notification.getCorrelationId(),
                notification.getMetadata()
        );
    }
}
