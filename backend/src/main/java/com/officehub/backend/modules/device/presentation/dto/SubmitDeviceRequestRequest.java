package com.officehub.backend.modules.device.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record SubmitDeviceRequestRequest(
        @NotNull UUID deviceId
) {
}
