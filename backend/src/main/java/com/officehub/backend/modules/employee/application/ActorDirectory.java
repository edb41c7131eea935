package com.officehub.backend.modules.employee.application;

import java.util.UUID;

import com.officehub.backend.modules.employee.domain.Actor;

/**
 * Read-only view of the employee directory used for authorization decisions.
 */
public interface ActorDirectory {

    /**
     * @throws org.springframework.web.server.ResponseStatusException 401 when the id is unknown
     */
    Actor resolve(UUID actorId);
}
