package com.officehub.backend.modules.approval.application;

import java.util.Objects;
import java.util.UUID;

import com.officehub.backend.global.error.WorkflowException;
import com.officehub.backend.modules.approval.domain.GateDecision;
import com.officehub.backend.modules.approval.domain.GatedOperation;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.employee.domain.EmployeeRole;

import org.springframework.stereotype.Component;

/**
 * Stateless authorization checks shared by the device, booking and leave workflows.
 * Every check here runs before the caller reads or writes workflow state.
 */
@Component
public class ApprovalGate {

    public static final String ROLE_NOT_PERMITTED = "ROLE_NOT_PERMITTED";
    public static final String ACTOR_INACTIVE = "ACTOR_INACTIVE";
    public static final String NOT_SUPERVISOR = "NOT_SUPERVISOR";
    public static final String SELF_DECISION_FORBIDDEN = "SELF_DECISION_FORBIDDEN";

    public GateDecision check(Actor actor, GatedOperation operation) {
        Objects.requireNonNull(operation, "operation");
        if (actor == null || !actor.active()) {
            return GateDecision.deny(ACTOR_INACTIVE);
        }
        if (operation.isOpenToAllEmployees() || actor.hasAnyRole(operation.requiredRoles())) {
            return GateDecision.allow();
        }
        return GateDecision.deny(ROLE_NOT_PERMITTED);
    }

    public void require(Actor actor, GatedOperation operation) {
        GateDecision decision = check(actor, operation);
        if (!decision.allowed()) {
            throw WorkflowException.forbidden(decision.denialCode());
        }
    }

    /**
     * Allows the direct supervisor of {@code subjectId}, or a super admin. Nobody may
     * decide on their own request, super admins included.
     */
    public void requireSupervisorOf(Actor actor, UUID subjectId, UUID subjectSupervisorId) {
        if (actor.is(subjectId)) {
            throw WorkflowException.forbidden(SELF_DECISION_FORBIDDEN);
        }
        if (actor.role() == EmployeeRole.SUPER_ADMIN) {
            return;
        }
        if (subjectSupervisorId == null || !actor.is(subjectSupervisorId)) {
            throw WorkflowException.forbidden(NOT_SUPERVISOR);
        }
    }

    public void requireOwner(Actor actor, UUID ownerId, String denialCode) {
        if (ownerId == null || !actor.is(ownerId)) {
            throw WorkflowException.forbidden(denialCode);
        }
    }
}
