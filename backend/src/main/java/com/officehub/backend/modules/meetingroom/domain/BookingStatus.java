package com.officehub.backend.modules.meetingroom.domain;

public enum BookingStatus {
    CONFIRMED,
    COMPLETED,
    CANCELLED
}
