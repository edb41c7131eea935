package com.officehub.backend.modules.device.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.officehub.backend.global.error.WorkflowException;
import com.officehub.backend.modules.approval.application.ApprovalGate;
import com.officehub.backend.modules.approval.domain.GatedOperation;
import com.officehub.backend.modules.audit.application.AuditLogService;
import com.officehub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.officehub.backend.modules.device.domain.Device;
import com.officehub.backend.modules.device.domain.DeviceRequestStatus;
import com.officehub.backend.modules.device.domain.DeviceStatus;
import com.officehub.backend.modules.device.infrastructure.persistence.DeviceRepository;
import com.officehub.backend.modules.device.infrastructure.persistence.DeviceRequestRepository;
import com.officehub.backend.modules.device.presentation.dto.CreateDeviceRequest;
import com.officehub.backend.modules.device.presentation.dto.DeviceDtoMapper;
import com.officehub.backend.modules.device.presentation.dto.DeviceResponse;
import com.officehub.backend.modules.device.presentation.dto.UpdateDeviceRequest;
import com.officehub.backend.modules.employee.domain.Actor;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Device inventory maintained by device administrators.
 */
@Service
@Transactional
public class DeviceService {

    static final String DEVICE_NOT_FOUND = "DEVICE_NOT_FOUND";
    static final String DEVICE_HAS_ACTIVE_REQUEST = "DEVICE_HAS_ACTIVE_REQUEST";

    private final DeviceRepository deviceRepository;
    private final DeviceRequestRepository deviceRequestRepository;
    private final ApprovalGate approvalGate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public DeviceService(
            DeviceRepository deviceRepository,
            DeviceRequestRepository deviceRequestRepository,
            ApprovalGate approvalGate,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.deviceRepository = deviceRepository;
        this.deviceRequestRepository = deviceRequestRepository;
        this.approvalGate = approvalGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<DeviceResponse> listDevices() {
        return deviceRepository.findByDeletedAtIsNullOrderByNameAsc().stream()
                .map(DeviceDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DeviceResponse> listAvailableDevices() {
        return deviceRepository.findByStatusAndDeletedAtIsNullOrderByNameAsc(DeviceStatus.AVAILABLE).stream()
                .map(DeviceDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public DeviceResponse getDevice(UUID deviceId) {
        return DeviceDtoMapper.toResponse(loadLiveDevice(deviceId));
    }

    public DeviceResponse createDevice(Actor actor, CreateDeviceRequest request) {
        approvalGate.require(actor, GatedOperation.DEVICE_MANAGE);

        Device device = new Device();
        device.setName(request.name().trim());
        device.setType(StringUtils.hasText(request.type()) ? request.type().trim() : null);
        device.setDescription(request.description());
        device.setStatus(DeviceStatus.AVAILABLE);
        Device saved = deviceRepository.save(device);

        auditLogService.record(new AuditLogCommand(
                "DEVICE_CREATED", "DEVICE", saved.getId(), actor.id(), Map.of("name", saved.getName())));
        return DeviceDtoMapper.toResponse(saved);
    }

    public DeviceResponse updateDevice(Actor actor, UUID deviceId, UpdateDeviceRequest request) {
        approvalGate.require(actor, GatedOperation.DEVICE_MANAGE);
        Device device = loadLiveDevice(deviceId);

        if (StringUtils.hasText(request.name())) {
            device.setName(request.name().trim());
        }
        if (StringUtils.hasText(request.type())) {
            device.setType(request.type().trim());
        }
        if (StringUtils.hasText(request.description())) {
            device.setDescription(request.description());
        }

        auditLogService.record(new AuditLogCommand(
                "DEVICE_UPDATED", "DEVICE", device.getId(), actor.id(), null));
        return DeviceDtoMapper.toResponse(device);
    }

    public void deleteDevice(Actor actor, UUID deviceId) {
        approvalGate.require(actor, GatedOperation.DEVICE_MANAGE);
        Device device = deviceRepository.findByIdForUpdate(deviceId)
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> WorkflowException.notFound(DEVICE_NOT_FOUND));

        if (deviceRequestRepository.existsByDeviceIdAndStatusIn(deviceId, DeviceRequestStatus.ACTIVE)) {
            throw WorkflowException.conflict(DEVICE_HAS_ACTIVE_REQUEST,
                    "device " + deviceId + " still has an active request");
        }
        device.setDeletedAt(OffsetDateTime.now(clock));

        auditLogService.record(new AuditLogCommand(
                "DEVICE_DELETED", "DEVICE", device.getId(), actor.id(), null));
    }

    private Device loadLiveDevice(UUID deviceId) {
        return deviceRepository.findByIdAndDeletedAtIsNull(deviceId)
                .orElseThrow(() -> WorkflowException.notFound(DEVICE_NOT_FOUND));
    }
}
