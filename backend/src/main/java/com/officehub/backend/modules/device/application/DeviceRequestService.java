package com.officehub.backend.modules.device.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.officehub.backend.global.error.WorkflowException;
import com.officehub.backend.modules.approval.application.ApprovalGate;
import com.officehub.backend.modules.approval.domain.GatedOperation;
import com.officehub.backend.modules.audit.application.AuditLogService;
import com.officehub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.officehub.backend.modules.device.domain.Device;
import com.officehub.backend.modules.device.domain.DeviceRequest;
import com.officehub.backend.modules.device.domain.DeviceRequestStatus;
import com.officehub.backend.modules.device.domain.DeviceStatus;
import com.officehub.backend.modules.device.infrastructure.persistence.DeviceRepository;
import com.officehub.backend.modules.device.infrastructure.persistence.DeviceRequestRepository;
import com.officehub.backend.modules.device.presentation.dto.DeviceDtoMapper;
import com.officehub.backend.modules.device.presentation.dto.DeviceRequestResponse;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.employee.infrastructure.persistence.EmployeeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Lifecycle of device borrow requests.
 *
 * <p>Every transition locks the device row before the request row so that two
 * transitions on the same device serialize in the same order as a concurrent
 * create. The device status is written in the same transaction as the request.</p>
 */
@Service
@Transactional
public class DeviceRequestService {

    private static final Logger log = LoggerFactory.getLogger(DeviceRequestService.class);

    static final String DEVICE_REQUEST_NOT_FOUND = "DEVICE_REQUEST_NOT_FOUND";
    static final String DEVICE_REQUEST_INVALID_STATUS = "DEVICE_REQUEST_INVALID_STATUS";
    static final String NOT_REQUEST_OWNER = "NOT_REQUEST_OWNER";
    private static final String ACTIVE_REQUEST_CONSTRAINT = "uq_device_request_active";
    private static final String RESOURCE_TYPE = "DEVICE_REQUEST";

    private final DeviceRepository deviceRepository;
    private final DeviceRequestRepository deviceRequestRepository;
    private final EmployeeRepository employeeRepository;
    private final ApprovalGate approvalGate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public DeviceRequestService(
            DeviceRepository deviceRepository,
            DeviceRequestRepository deviceRequestRepository,
            EmployeeRepository employeeRepository,
            ApprovalGate approvalGate,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.deviceRepository = deviceRepository;
        this.deviceRequestRepository = deviceRequestRepository;
        this.employeeRepository = employeeRepository;
        this.approvalGate = approvalGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public DeviceRequestResponse create(Actor actor, UUID deviceId) {
        approvalGate.require(actor, GatedOperation.DEVICE_REQUEST_CREATE);

        Device device = deviceRepository.findByIdForUpdate(deviceId)
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> WorkflowException.notFound(DeviceService.DEVICE_NOT_FOUND));

        if (deviceRequestRepository.existsByDeviceIdAndStatusIn(deviceId, DeviceRequestStatus.ACTIVE)) {
            log.warn("Rejected device request: device={} already has an active request, actor={}", deviceId, actor.id());
            throw activeRequestConflict(deviceId);
        }

        DeviceRequest request = new DeviceRequest();
        request.setDevice(device);
        request.setRequester(employeeRepository.getReferenceById(actor.id()));
        request.setStatus(DeviceRequestStatus.PENDING);
        request.setRequestedAt(OffsetDateTime.now(clock));
        device.setStatus(DeviceStatus.UNDER_REQUEST);

        DeviceRequest saved;
        try {
            saved = deviceRequestRepository.saveAndFlush(request);
        } catch (DataIntegrityViolationException ex) {
            if (isActiveRequestViolation(ex)) {
                log.warn("Concurrent device request lost the race: device={}, actor={}", deviceId, actor.id());
                throw activeRequestConflict(deviceId);
            }
            throw ex;
        }

        recordTransition("DEVICE_REQUEST_CREATED", saved, actor, null, DeviceRequestStatus.PENDING, null);
        return toResponse(saved);
    }

    public DeviceRequestResponse approve(Actor actor, UUID requestId) {
        approvalGate.require(actor, GatedOperation.DEVICE_REQUEST_APPROVE);
        DeviceRequest request = lockForTransition(requestId);
        DeviceRequestStatus from = requireStatus(request, DeviceRequestStatus.PENDING);

        request.setStatus(DeviceRequestStatus.APPROVED);
        request.setDecidedBy(employeeRepository.getReferenceById(actor.id()));
        request.setDecidedAt(OffsetDateTime.now(clock));

        recordTransition("DEVICE_REQUEST_APPROVED", request, actor, from, DeviceRequestStatus.APPROVED, null);
        return toResponse(request);
    }

    public DeviceRequestResponse reject(Actor actor, UUID requestId, String reason) {
        approvalGate.require(actor, GatedOperation.DEVICE_REQUEST_REJECT);
        DeviceRequest request = lockForTransition(requestId);
        DeviceRequestStatus from = requireStatus(request, DeviceRequestStatus.PENDING);

        request.setStatus(DeviceRequestStatus.REJECTED);
        request.setDecidedBy(employeeRepository.getReferenceById(actor.id()));
        request.setDecidedAt(OffsetDateTime.now(clock));
        request.setRejectReason(StringUtils.hasText(reason) ? reason.trim() : null);
        request.getDevice().setStatus(DeviceStatus.AVAILABLE);

        recordTransition("DEVICE_REQUEST_REJECTED", request, actor, from, DeviceRequestStatus.REJECTED,
                request.getRejectReason());
        return toResponse(request);
    }

    public DeviceRequestResponse collect(Actor actor, UUID requestId) {
        approvalGate.require(actor, GatedOperation.DEVICE_REQUEST_COLLECT);
        DeviceRequest request = lockForTransition(requestId);
        approvalGate.requireOwner(actor, request.getRequester().getId(), NOT_REQUEST_OWNER);
        DeviceRequestStatus from = requireStatus(request, DeviceRequestStatus.APPROVED);

        request.setStatus(DeviceRequestStatus.COLLECTED);
        request.setCollectedAt(OffsetDateTime.now(clock));
        request.getDevice().setStatus(DeviceStatus.BORROWED);

        recordTransition("DEVICE_REQUEST_COLLECTED", request, actor, from, DeviceRequestStatus.COLLECTED, null);
        return toResponse(request);
    }

    public DeviceRequestResponse initiateReturn(Actor actor, UUID requestId) {
        approvalGate.require(actor, GatedOperation.DEVICE_REQUEST_RETURN);
        DeviceRequest request = lockForTransition(requestId);
        approvalGate.requireOwner(actor, request.getRequester().getId(), NOT_REQUEST_OWNER);
        DeviceRequestStatus from = requireStatus(request, DeviceRequestStatus.COLLECTED);

        request.setStatus(DeviceRequestStatus.RETURN_PENDING);
        request.setReturnRequestedAt(OffsetDateTime.now(clock));

        recordTransition("DEVICE_REQUEST_RETURN_REQUESTED", request, actor, from,
                DeviceRequestStatus.RETURN_PENDING, null);
        return toResponse(request);
    }

    public DeviceRequestResponse confirmReturn(Actor actor, UUID requestId) {
        approvalGate.require(actor, GatedOperation.DEVICE_REQUEST_CONFIRM_RETURN);
        DeviceRequest request = lockForTransition(requestId);
        DeviceRequestStatus from = requireStatus(request, DeviceRequestStatus.RETURN_PENDING);

        request.setStatus(DeviceRequestStatus.RETURNED);
        request.setReturnConfirmedBy(employeeRepository.getReferenceById(actor.id()));
        request.setReturnedAt(OffsetDateTime.now(clock));
        request.getDevice().setStatus(DeviceStatus.AVAILABLE);

        recordTransition("DEVICE_REQUEST_RETURNED", request, actor, from, DeviceRequestStatus.RETURNED, null);
        return toResponse(request);
    }

    public DeviceRequestResponse cancel(Actor actor, UUID requestId) {
        approvalGate.require(actor, GatedOperation.DEVICE_REQUEST_CANCEL);
        DeviceRequest request = lockForTransition(requestId);
        approvalGate.requireOwner(actor, request.getRequester().getId(), NOT_REQUEST_OWNER);
        DeviceRequestStatus from = requireStatus(request, DeviceRequestStatus.PENDING, DeviceRequestStatus.APPROVED);

        request.setStatus(DeviceRequestStatus.CANCELLED);
        request.setCancelledAt(OffsetDateTime.now(clock));
        request.getDevice().setStatus(DeviceStatus.AVAILABLE);

        recordTransition("DEVICE_REQUEST_CANCELLED", request, actor, from, DeviceRequestStatus.CANCELLED, null);
        return toResponse(request);
    }

    @Transactional(readOnly = true)
    public List<DeviceRequestResponse> listMine(Actor actor) {
        return deviceRequestRepository.findByRequesterNewestFirst(actor.id()).stream()
                .map(DeviceDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DeviceRequestResponse> listPending(Actor actor) {
        approvalGate.require(actor, GatedOperation.DEVICE_REQUEST_REVIEW);
        return deviceRequestRepository.findByStatusOldestFirst(DeviceRequestStatus.PENDING).stream()
                .map(DeviceDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DeviceRequestResponse> listReturnPending(Actor actor) {
        approvalGate.require(actor, GatedOperation.DEVICE_REQUEST_REVIEW);
        return deviceRequestRepository.findByStatusOldestFirst(DeviceRequestStatus.RETURN_PENDING).stream()
                .map(DeviceDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public DeviceRequestResponse get(Actor actor, UUID requestId) {
        DeviceRequest request = deviceRequestRepository.findDetailedById(requestId)
                .orElseThrow(() -> WorkflowException.notFound(DEVICE_REQUEST_NOT_FOUND));
        boolean reviewer = approvalGate.check(actor, GatedOperation.DEVICE_REQUEST_REVIEW).allowed();
        if (!reviewer) {
            approvalGate.requireOwner(actor, request.getRequester().getId(), NOT_REQUEST_OWNER);
        }
        return toResponse(request);
    }

    private DeviceRequest lockForTransition(UUID requestId) {
        UUID deviceId = deviceRequestRepository.findDeviceIdByRequestId(requestId)
                .orElseThrow(() -> WorkflowException.notFound(DEVICE_REQUEST_NOT_FOUND));
        deviceRepository.findByIdForUpdate(deviceId)
                .orElseThrow(() -> WorkflowException.notFound(DeviceService.DEVICE_NOT_FOUND));
        return deviceRequestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> WorkflowException.notFound(DEVICE_REQUEST_NOT_FOUND));
    }

    private DeviceRequestStatus requireStatus(DeviceRequest request, DeviceRequestStatus... allowed) {
        DeviceRequestStatus current = request.getStatus();
        if (!Set.of(allowed).contains(current)) {
            throw WorkflowException.invalidTransition(DEVICE_REQUEST_INVALID_STATUS,
                    "device request " + request.getId() + " is " + current);
        }
        return current;
    }

    private void recordTransition(
            String action,
            DeviceRequest request,
            Actor actor,
            DeviceRequestStatus from,
            DeviceRequestStatus to,
            String reason
    ) {
        log.info("Device request {} {} -> {} by {}", request.getId(), from, to, actor.id());

        Map<String, Object> detail = new HashMap<>();
        detail.put("deviceId", request.getDevice().getId().toString());
        detail.put("to", to.name());
        if (from != null) {
            detail.put("from", from.name());
        }
        if (reason != null) {
            detail.put("reason", reason);
        }
        auditLogService.record(new AuditLogCommand(action, RESOURCE_TYPE, request.getId(), actor.id(), detail));
    }

    private DeviceRequestResponse toResponse(DeviceRequest request) {
        return DeviceDtoMapper.toResponse(request);
    }

    private WorkflowException activeRequestConflict(UUID deviceId) {
        return WorkflowException.conflict(DeviceService.DEVICE_HAS_ACTIVE_REQUEST,
                "device " + deviceId + " already has an active request");
    }

    private boolean isActiveRequestViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(ACTIVE_REQUEST_CONSTRAINT);
    }
}
