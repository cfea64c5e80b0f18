package com.itms.backend.modules.auth.domain;

public enum Capability {
    READ_BOOKING,
    CREATE_BOOKING,
    UPDATE_BOOKING,
    APPROVE_BOOKING,
    MANAGE_RESOURCES,
    VIEW_REPORTS
}
