package com.itms.backend.modules.resource.domain;

public enum ResourceStatus {
    AVAILABLE,
    MAINTENANCE,
    RETIRED;

    public boolean acceptsBookings() {
        return this == AVAILABLE;
    }
}
