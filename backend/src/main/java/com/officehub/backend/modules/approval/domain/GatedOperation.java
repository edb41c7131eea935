package com.officehub.backend.modules.approval.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import com.officehub.backend.modules.employee.domain.EmployeeRole;

/**
 * Operations guarded by a role requirement. An empty role set means any active
 * employee may invoke the operation; ownership and supervisor scope are checked
 * separately once the subject is loaded.
 */
public enum GatedOperation {

    DEVICE_MANAGE(EmployeeRole.DEVICE_ADMIN, EmployeeRole.SUPER_ADMIN),
    DEVICE_REQUEST_CREATE(),
    DEVICE_REQUEST_APPROVE(EmployeeRole.DEVICE_ADMIN, EmployeeRole.SUPER_ADMIN),
    DEVICE_REQUEST_REJECT(EmployeeRole.DEVICE_ADMIN, EmployeeRole.SUPER_ADMIN),
    DEVICE_REQUEST_COLLECT(),
    DEVICE_REQUEST_RETURN(),
    DEVICE_REQUEST_CONFIRM_RETURN(EmployeeRole.DEVICE_ADMIN, EmployeeRole.SUPER_ADMIN),
    DEVICE_REQUEST_CANCEL(),
    DEVICE_REQUEST_REVIEW(EmployeeRole.DEVICE_ADMIN, EmployeeRole.SUPER_ADMIN),

    MEETING_ROOM_MANAGE(EmployeeRole.SUPER_ADMIN),
    BOOKING_CREATE(),
    BOOKING_CANCEL(),
    BOOKING_COMPLETE(),

    LEAVE_CREATE(),
    LEAVE_DECIDE(EmployeeRole.SUPERVISOR, EmployeeRole.SUPER_ADMIN),
    LEAVE_CANCEL();

    private final Set<EmployeeRole> requiredRoles;

    GatedOperation(EmployeeRole... roles) {
        this.requiredRoles = Collections.unmodifiableSet(roles.length == 0
                ? EnumSet.noneOf(EmployeeRole.class)
                : EnumSet.of(roles[0], roles));
    }

    public Set<EmployeeRole> requiredRoles() {
        return requiredRoles;
    }

    public boolean isOpenToAllEmployees() {
        return requiredRoles.isEmpty();
    }
}
