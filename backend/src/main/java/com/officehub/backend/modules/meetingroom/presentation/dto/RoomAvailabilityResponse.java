package com.officehub.backend.modules.meetingroom.presentation.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record RoomAvailabilityResponse(
        UUID roomId,
        String roomName,
        LocalDate date,
        String zone,
        List<BookingResponse> bookings
) {
}
