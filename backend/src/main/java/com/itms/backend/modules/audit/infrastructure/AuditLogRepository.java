package com.itms.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.itms.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByResourceTypeAndResourceKeyOrderByCreatedAtAsc(String resourceType, String resourceKey);
}
