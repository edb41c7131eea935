package com.officehub.backend.modules.leave.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.officehub.backend.modules.employee.domain.Employee;
import com.officehub.backend.modules.leave.domain.LeaveRequest;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LeaveResponse(
        UUID leaveId,
        UUID requesterId,
        String requesterName,
        String leaveType,
        LocalDate startDate,
        LocalDate endDate,
        String reason,
        String status,
        UUID decidedBy,
        OffsetDateTime decidedAt,
        String rejectReason,
        OffsetDateTime createdAt
) {

    public static LeaveResponse from(LeaveRequest leave) {
        Employee requester = leave.getRequester();
        Employee decidedBy = leave.getDecidedBy();
        return new LeaveResponse(
                leave.getId(),
                requester.getId(),
                requester.getFullName(),
                leave.getLeaveType().name(),
                leave.getStartDate(),
                leave.getEndDate(),
                leave.getReason(),
                leave.getStatus().name(),
                decidedBy != null ? decidedBy.getId() : null,
                leave.getDecidedAt(),
                leave.getRejectReason(),
                leave.getCreatedAt()
        );
    }
}
