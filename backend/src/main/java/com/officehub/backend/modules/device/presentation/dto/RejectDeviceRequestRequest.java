package com.officehub.backend.modules.device.presentation.dto;

import jakarta.validation.constraints.Size;

public record RejectDeviceRequestRequest(
        @Size(max = 500) String reason
) {
}
