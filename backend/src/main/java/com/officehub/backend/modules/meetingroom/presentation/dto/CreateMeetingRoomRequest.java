package com.officehub.backend.modules.meetingroom.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateMeetingRoomRequest(
        @NotBlank @Size(max = 100) String name,
        @NotNull @Min(1) Integer capacity,
        @Size(max = 200) String location
) {
}
