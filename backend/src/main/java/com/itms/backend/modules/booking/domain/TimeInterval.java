package com.itms.backend.modules.booking.domain;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)} in UTC. Construction rejects {@code start >= end}.
 */
public record TimeInterval(OffsetDateTime start, OffsetDateTime end) {

    public TimeInterval {
        if (start == null || end == null) {
            throw BookingException.invalidInterval("start and end are required");
        }
        start = start.withOffsetSameInstant(ZoneOffset.UTC);
        end = end.withOffsetSameInstant(ZoneOffset.UTC);
        if (!start.isBefore(end)) {
            throw BookingException.invalidInterval("start must be before end");
        }
    }

    public static TimeInterval of(OffsetDateTime start, OffsetDateTime end) {
        return new TimeInterval(start, end);
    }

    public static TimeInterval of(Instant start, Instant end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        return new TimeInterval(start.atOffset(ZoneOffset.UTC), end.atOffset(ZoneOffset.UTC));
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean startsAtOrBefore(OffsetDateTime instant) {
        return !start.isAfter(instant);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /**
     * Portion of this interval inside {@code range}; callers check {@link #overlaps} first.
     */
    public TimeInterval clipTo(TimeInterval range) {
        OffsetDateTime clippedStart = start.isBefore(range.start) ? range.start : start;
        OffsetDateTime clippedEnd = end.isAfter(range.end) ? range.end : end;
        return new TimeInterval(clippedStart, clippedEnd);
    }
}
