package com.officehub.backend.modules.meetingroom.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeetingRoomResponse(
        UUID roomId,
        String name,
        int capacity,
        String location,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
