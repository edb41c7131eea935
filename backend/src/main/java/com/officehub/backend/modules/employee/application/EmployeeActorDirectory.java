package com.officehub.backend.modules.employee.application;

import java.util.UUID;

import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.employee.domain.Employee;
import com.officehub.backend.modules.employee.infrastructure.persistence.EmployeeRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(readOnly = true)
public class EmployeeActorDirectory implements ActorDirectory {

    private final EmployeeRepository employeeRepository;

    public EmployeeActorDirectory(EmployeeRepository employeeRepository) {
        this.employeeRepository = employeeRepository;
    }

    @Override
    public Actor resolve(UUID actorId) {
        Employee employee = employeeRepository.findById(actorId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "ACTOR_NOT_FOUND"));
        UUID supervisorId = employee.getSupervisor() != null ? employee.getSupervisor().getId() : null;
        return new Actor(employee.getId(), employee.getRole(), supervisorId, employee.isActive());
    }
}
