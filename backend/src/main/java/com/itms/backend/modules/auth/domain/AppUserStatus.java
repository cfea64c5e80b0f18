package com.itms.backend.modules.auth.domain;

public enum AppUserStatus {
    ACTIVE,
    INACTIVE
}
