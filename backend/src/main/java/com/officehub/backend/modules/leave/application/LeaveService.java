package com.officehub.backend.modules.leave.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.officehub.backend.global.error.WorkflowException;
import com.officehub.backend.modules.approval.application.ApprovalGate;
import com.officehub.backend.modules.approval.domain.GatedOperation;
import com.officehub.backend.modules.audit.application.AuditLogService;
import com.officehub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.employee.domain.Employee;
import com.officehub.backend.modules.employee.domain.EmployeeRole;
import com.officehub.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.officehub.backend.modules.leave.domain.LeaveRequest;
import com.officehub.backend.modules.leave.domain.LeaveStatus;
import com.officehub.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.officehub.backend.modules.leave.presentation.dto.CreateLeaveRequest;
import com.officehub.backend.modules.leave.presentation.dto.LeaveResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class LeaveService {

    private static final Logger log = LoggerFactory.getLogger(LeaveService.class);

    static final String LEAVE_REQUEST_NOT_FOUND = "LEAVE_REQUEST_NOT_FOUND";
    static final String LEAVE_INVALID_STATUS = "LEAVE_INVALID_STATUS";
    static final String INVALID_LEAVE_RANGE = "INVALID_LEAVE_RANGE";
    private static final String RESOURCE_TYPE = "LEAVE_REQUEST";

    private final LeaveRequestRepository leaveRequestRepository;
    private final EmployeeRepository employeeRepository;
    private final ApprovalGate approvalGate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public LeaveService(
            LeaveRequestRepository leaveRequestRepository,
            EmployeeRepository employeeRepository,
            ApprovalGate approvalGate,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.leaveRequestRepository = leaveRequestRepository;
        this.employeeRepository = employeeRepository;
        this.approvalGate = approvalGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public LeaveResponse create(Actor actor, CreateLeaveRequest request) {
        approvalGate.require(actor, GatedOperation.LEAVE_CREATE);
        if (request.endDate().isBefore(request.startDate())) {
            throw WorkflowException.invalidInterval(INVALID_LEAVE_RANGE, "endDate must not be before startDate");
        }

        LeaveRequest leave = new LeaveRequest();
        leave.setRequester(employeeRepository.getReferenceById(actor.id()));
        leave.setLeaveType(request.leaveType());
        leave.setStartDate(request.startDate());
        leave.setEndDate(request.endDate());
        leave.setReason(StringUtils.hasText(request.reason()) ? request.reason().trim() : null);
        leave.setStatus(LeaveStatus.PENDING);
        LeaveRequest saved = leaveRequestRepository.save(leave);

        Map<String, Object> detail = new HashMap<>();
        detail.put("leaveType", saved.getLeaveType().name());
        detail.put("startDate", saved.getStartDate().toString());
        detail.put("endDate", saved.getEndDate().toString());
        recordTransition("LEAVE_REQUESTED", saved, actor, null, LeaveStatus.PENDING, detail);
        return LeaveResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<LeaveResponse> listMine(Actor actor) {
        return leaveRequestRepository.findByRequesterNewestFirst(actor.id()).stream()
                .map(LeaveResponse::from)
                .toList();
    }

    /**
     * Pending requests of the actor's direct reports. A super admin sees every pending request.
     */
    @Transactional(readOnly = true)
    public List<LeaveResponse> listPendingForSupervisor(Actor actor) {
        approvalGate.require(actor, GatedOperation.LEAVE_DECIDE);
        List<LeaveRequest> pending;
        if (actor.role() == EmployeeRole.SUPER_ADMIN) {
            pending = leaveRequestRepository.findAllByStatus(LeaveStatus.PENDING);
        } else {
            List<UUID> subordinateIds = employeeRepository.findSubordinateIds(actor.id());
            pending = subordinateIds.isEmpty()
                    ? List.of()
                    : leaveRequestRepository.findByStatusAndRequesterIdIn(LeaveStatus.PENDING, subordinateIds);
        }
        return pending.stream().map(LeaveResponse::from).toList();
    }

    public LeaveResponse approve(Actor actor, UUID leaveId) {
        approvalGate.require(actor, GatedOperation.LEAVE_DECIDE);
        LeaveRequest leave = loadForUpdate(leaveId);
        requireSupervisor(actor, leave);
        requirePending(leave);

        leave.setStatus(LeaveStatus.APPROVED);
        leave.setDecidedBy(employeeRepository.getReferenceById(actor.id()));
        leave.setDecidedAt(OffsetDateTime.now(clock));

        recordTransition("LEAVE_APPROVED", leave, actor, LeaveStatus.PENDING, LeaveStatus.APPROVED, null);
        return LeaveResponse.from(leave);
    }

    public LeaveResponse reject(Actor actor, UUID leaveId, String reason) {
        approvalGate.require(actor, GatedOperation.LEAVE_DECIDE);
        LeaveRequest leave = loadForUpdate(leaveId);
        requireSupervisor(actor, leave);
        requirePending(leave);

        leave.setStatus(LeaveStatus.REJECTED);
        leave.setDecidedBy(employeeRepository.getReferenceById(actor.id()));
        leave.setDecidedAt(OffsetDateTime.now(clock));
        leave.setRejectReason(StringUtils.hasText(reason) ? reason.trim() : null);

        Map<String, Object> detail = leave.getRejectReason() != null ? Map.of("reason", leave.getRejectReason()) : null;
        recordTransition("LEAVE_REJECTED", leave, actor, LeaveStatus.PENDING, LeaveStatus.REJECTED, detail);
        return LeaveResponse.from(leave);
    }

    /**
     * The requester may withdraw a pending request; otherwise the caller must be the
     * requester's supervisor (or a super admin).
     */
    public LeaveResponse cancel(Actor actor, UUID leaveId) {
        approvalGate.require(actor, GatedOperation.LEAVE_CANCEL);
        LeaveRequest leave = loadForUpdate(leaveId);
        boolean byRequester = actor.is(leave.getRequester().getId());
        if (!byRequester) {
            approvalGate.require(actor, GatedOperation.LEAVE_DECIDE);
            requireSupervisor(actor, leave);
        }
        requirePending(leave);

        leave.setStatus(LeaveStatus.CANCELLED);

        Map<String, Object> detail = Map.of("cancelledBy", byRequester ? "REQUESTER" : "SUPERVISOR");
        recordTransition("LEAVE_CANCELLED", leave, actor, LeaveStatus.PENDING, LeaveStatus.CANCELLED, detail);
        return LeaveResponse.from(leave);
    }

    private LeaveRequest loadForUpdate(UUID leaveId) {
        return leaveRequestRepository.findByIdForUpdate(leaveId)
                .orElseThrow(() -> WorkflowException.notFound(LEAVE_REQUEST_NOT_FOUND));
    }

    private void requireSupervisor(Actor actor, LeaveRequest leave) {
        Employee requester = leave.getRequester();
        UUID supervisorId = requester.getSupervisor() != null ? requester.getSupervisor().getId() : null;
        approvalGate.requireSupervisorOf(actor, requester.getId(), supervisorId);
    }

    private void requirePending(LeaveRequest leave) {
        if (leave.getStatus() != LeaveStatus.PENDING) {
            throw WorkflowException.invalidTransition(LEAVE_INVALID_STATUS,
                    "leave request " + leave.getId() + " is " + leave.getStatus());
        }
    }

    private void recordTransition(
            String action,
            LeaveRequest leave,
            Actor actor,
            LeaveStatus from,
            LeaveStatus to,
            Map<String, Object> extra
    ) {
        log.info("Leave request {} {} -> {} by {}", leave.getId(), from, to, actor.id());

        Map<String, Object> detail = new HashMap<>();
        if (extra != null) {
            detail.putAll(extra);
        }
        detail.put("to", to.name());
        if (from != null) {
            detail.put("from", from.name());
        }
        auditLogService.record(new AuditLogCommand(action, RESOURCE_TYPE, leave.getId(), actor.id(), detail));
    }
}
