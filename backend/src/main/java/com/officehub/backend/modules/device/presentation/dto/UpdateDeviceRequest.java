package com.officehub.backend.modules.device.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update; null or blank fields keep their current value.
 */
public record UpdateDeviceRequest(
        @Size(max = 100) String name,
        @Size(max = 50) String type,
        String description
) {
}
