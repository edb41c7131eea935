package com.officehub.backend.modules.leave.presentation.dto;

import jakarta.validation.constraints.Size;

public record RejectLeaveRequest(
        @Size(max = 500) String reason
) {
}
