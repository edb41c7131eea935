package com.officehub.backend.modules.employee.domain;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * The resolved identity an operation runs as. Passed explicitly into every
 * workflow operation; nothing in the engine reads a thread-bound session.
 */
public record Actor(UUID id, EmployeeRole role, UUID supervisorId, boolean active) {

    public Actor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
    }

    public boolean hasAnyRole(Set<EmployeeRole> roles) {
        return roles.contains(role);
    }

    public boolean is(UUID employeeId) {
        return id.equals(employeeId);
    }
}
