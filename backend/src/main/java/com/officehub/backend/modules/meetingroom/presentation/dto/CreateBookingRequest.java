package com.officehub.backend.modules.meetingroom.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * startAt and endAt are validated by the booking engine so a missing bound is
 * reported as an invalid interval rather than a generic validation error.
 */
public record CreateBookingRequest(
        @NotNull UUID roomId,
        OffsetDateTime startAt,
        OffsetDateTime endAt,
        @Size(max = 200) String title
) {
}
