package com.officehub.backend.modules.device.domain;

import java.util.EnumSet;
import java.util.Set;

public enum DeviceRequestStatus {
    PENDING,
    APPROVED,
    REJECTED,
    COLLECTED,
    RETURN_PENDING,
    RETURNED,
    CANCELLED;

    public static final Set<DeviceRequestStatus> ACTIVE =
            EnumSet.of(PENDING, APPROVED, COLLECTED, RETURN_PENDING);
}
