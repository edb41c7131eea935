package com.officehub.backend.modules.device.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateDeviceRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 50) String type,
        String description
) {
}
