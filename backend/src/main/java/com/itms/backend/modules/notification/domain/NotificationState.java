package com.itms.backend.modules.notification.domain;

public enum NotificationState {
    UNREAD,
    READ,
    EXPIRED
}
