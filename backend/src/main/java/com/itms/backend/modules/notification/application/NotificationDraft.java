package com.itms.backend.modules.notification.application;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Content of a notification before it is addressed to a user. A {@code null} dedupe key disables deduplication.
 */
public record NotificationDraft(
        String kindCode,
        String title,
        String body,
        String dedupeKey,
        Map<String, Object> metadata,
        int ttlHours,
        UUID correlationId
) {

    public NotificationDraft {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (ttlHours <= 0) {
            throw new IllegalArgumentException("ttlHours must be positive");
        }
    }
}
