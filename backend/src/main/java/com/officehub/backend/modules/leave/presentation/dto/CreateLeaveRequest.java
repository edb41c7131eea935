package com.officehub.backend.modules.leave.presentation.dto;

import java.time.LocalDate;

import com.officehub.backend.modules.leave.domain.LeaveType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateLeaveRequest(
        @NotNull LeaveType leaveType,
        @NotNull LocalDate startDate,
        @NotNull LocalDate endDate,
        @Size(max = 500) String reason
) {
}
