package com.itms.backend.modules.booking.domain;

public enum ActorKind {
    REQUESTER,
    APPROVER,
    SYSTEM
}
