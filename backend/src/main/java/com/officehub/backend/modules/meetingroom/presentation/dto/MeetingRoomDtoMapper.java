package com.officehub.backend.modules.meetingroom.presentation.dto;

import com.officehub.backend.modules.employee.domain.Employee;
import com.officehub.backend.modules.meetingroom.domain.Booking;
import com.officehub.backend.modules.meetingroom.domain.MeetingRoom;

public final class MeetingRoomDtoMapper {

    private MeetingRoomDtoMapper() {
    }

    public static MeetingRoomResponse toResponse(MeetingRoom room) {
        return new MeetingRoomResponse(
                room.getId(),
                room.getName(),
                room.getCapacity(),
                room.getLocation(),
                room.getCreatedAt(),
                room.getUpdatedAt()
        );
    }

    public static BookingResponse toResponse(Booking booking) {
        MeetingRoom room = booking.getRoom();
        Employee requester = booking.getRequester();
        return new BookingResponse(
                booking.getId(),
                room.getId(),
                room.getName(),
                requester.getId(),
                requester.getFullName(),
                booking.getTitle(),
                booking.getStartAt(),
                booking.getEndAt(),
                booking.getStatus().name(),
                booking.getCompletedAt(),
                booking.getCancelledAt(),
                booking.getCreatedAt()
        );
    }
}
