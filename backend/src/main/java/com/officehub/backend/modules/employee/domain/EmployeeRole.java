package com.officehub.backend.modules.employee.domain;

public enum EmployeeRole {
    SUPER_ADMIN,
    HR,
    FINANCE,
    DEVICE_ADMIN,
    SUPERVISOR,
    EMPLOYEE
}
