package com.itms.backend.modules.booking.application;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Per-resource mutual exclusion for booking writes. Work on different resources never contends.
 * A lock that cannot be obtained in time fails with {@code BookingException.storeUnavailable}.
 */
public interface ResourceLock {

    <T> T withLock(UUID resourceId, Supplier<T> work);
}
