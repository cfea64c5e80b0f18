package com.itms.backend.modules.booking.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Who triggers a booking operation. Resolved from the caller's identity before it reaches the engine;
 * {@code userId} is {@code null} only for {@link ActorKind#SYSTEM}.
 */
public record BookingActor(UUID userId, ActorKind kind) {

    public BookingActor {
        Objects.requireNonNull(kind, "kind");
        if (kind != ActorKind.SYSTEM) {
            Objects.requireNonNull(userId, "userId");
        }
    }

    public static BookingActor requester(UUID userId) {
        return new BookingActor(userId, ActorKind.REQUESTER);
    }

    public static BookingActor approver(UUID userId) {
        return new BookingActor(userId, ActorKind.APPROVER);
    }

    public static BookingActor system() {
        return new BookingActor(null, ActorKind.SYSTEM);
    }
}
