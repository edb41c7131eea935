package com.officehub.backend.modules.leave.domain;

public enum LeaveType {
    ANNUAL,
    SICK,
    PERSONAL,
    MARRIAGE,
    MATERNITY,
    BEREAVEMENT
}
