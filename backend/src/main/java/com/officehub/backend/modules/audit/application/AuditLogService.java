package com.officehub.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.officehub.backend.global.web.RequestIdFilter;
import com.officehub.backend.modules.audit.domain.AuditLog;
import com.officehub.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.officehub.backend.modules.employee.domain.Employee;

import jakarta.persistence.EntityManager;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes one audit row per successful workflow transition. Joins the caller's
 * transaction so a rolled back transition leaves no audit trace.
 */
@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceId(), "resourceId is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceId().toString());
        auditLog.setCreatedAt(OffsetDateTime.now(clock));
        auditLog.setRequestId(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        if (command.actorId() != null) {
            auditLog.setActor(entityManager.getReference(Employee.class, command.actorId()));
        }
        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new LinkedHashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            UUID resourceId,
            UUID actorId,
            Map<String, Object> detail
    ) {
    }
}
