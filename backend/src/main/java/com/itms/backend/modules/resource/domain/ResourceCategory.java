package com.itms.backend.modules.resource.domain;

public enum ResourceCategory {
    TRANSPORTATION,
    MEETING_ROOM,
    IT_EQUIPMENT,
    TOOL,
    FACILITY
}
