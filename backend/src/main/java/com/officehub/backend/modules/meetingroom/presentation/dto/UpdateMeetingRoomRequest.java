package com.officehub.backend.modules.meetingroom.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

public record UpdateMeetingRoomRequest(
        @Size(max = 100) String name,
        @Min(1) Integer capacity,
        @Size(max = 200) String location
) {
}
