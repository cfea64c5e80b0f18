package com.itms.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.itms.backend.modules.audit.domain.AuditLog;
import com.itms.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    public static final String RESOURCE_TYPE_BOOKING = "BOOKING";
    public static final String RESOURCE_TYPE_RESOURCE = "BOOKABLE_RESOURCE";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setCorrelationId(command.correlationId());
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> history(String resourceType, String resourceKey) {
        return auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc(resourceType, resourceKey);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            UUID correlationId,
            Map<String, Object> detail
    ) {
    }
}
