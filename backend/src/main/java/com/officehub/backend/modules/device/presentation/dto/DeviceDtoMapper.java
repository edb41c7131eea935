package com.officehub.backend.modules.device.presentation.dto;

import java.util.UUID;

import com.officehub.backend.modules.device.domain.Device;
import com.officehub.backend.modules.device.domain.DeviceRequest;
import com.officehub.backend.modules.employee.domain.Employee;

public final class DeviceDtoMapper {

    private DeviceDtoMapper() {
    }

    public static DeviceResponse toResponse(Device device) {
        return new DeviceResponse(
                device.getId(),
                device.getName(),
                device.getType(),
                device.getDescription(),
                device.getStatus().name(),
                device.getCreatedAt(),
                device.getUpdatedAt()
        );
    }

    public static DeviceRequestResponse toResponse(DeviceRequest request) {
        Device device = request.getDevice();
        Employee requester = request.getRequester();
        return new DeviceRequestResponse(
                request.getId(),
                device.getId(),
                device.getName(),
                device.getStatus().name(),
                requester.getId(),
                requester.getFullName(),
                request.getStatus().name(),
                request.getRequestedAt(),
                idOf(request.getDecidedBy()),
                request.getDecidedAt(),
                request.getRejectReason(),
                request.getCollectedAt(),
                request.getReturnRequestedAt(),
                idOf(request.getReturnConfirmedBy()),
                request.getReturnedAt(),
                request.getCancelledAt()
        );
    }

    private static UUID idOf(Employee employee) {
        return employee != null ? employee.getId() : null;
    }
}
