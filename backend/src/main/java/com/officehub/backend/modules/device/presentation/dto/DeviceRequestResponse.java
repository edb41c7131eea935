package com.officehub.backend.modules.device.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceRequestResponse(
        UUID requestId,
        UUID deviceId,
        String deviceName,
        String deviceStatus,
        UUID requesterId,
        String requesterName,
        String status,
        OffsetDateTime requestedAt,
        UUID decidedBy,
        OffsetDateTime decidedAt,
        String rejectReason,
        OffsetDateTime collectedAt,
        OffsetDateTime returnRequestedAt,
        UUID returnConfirmedBy,
        OffsetDateTime returnedAt,
        OffsetDateTime cancelledAt
) {
}
