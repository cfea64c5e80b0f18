package com.itms.backend.modules.booking.domain;

public record FreeBusySlot(TimeInterval interval, boolean busy) {

    public static FreeBusySlot busy(TimeInterval interval) {
        return new FreeBusySlot(interval, true);
    }

    public static FreeBusySlot free(TimeInterval interval) {
        return new FreeBusySlot(interval, false);
    }
}
