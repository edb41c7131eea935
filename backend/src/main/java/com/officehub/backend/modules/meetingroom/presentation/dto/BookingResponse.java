package com.officehub.backend.modules.meetingroom.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BookingResponse(
        UUID bookingId,
        UUID roomId,
        String roomName,
        UUID requesterId,
        String requesterName,
        String title,
        OffsetDateTime startAt,
        OffsetDateTime endAt,
        String status,
        OffsetDateTime completedAt,
        OffsetDateTime cancelledAt,
        OffsetDateTime createdAt
) {
}
