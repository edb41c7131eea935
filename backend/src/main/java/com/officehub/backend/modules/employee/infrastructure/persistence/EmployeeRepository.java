package com.officehub.backend.modules.employee.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.officehub.backend.modules.employee.domain.Employee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmployeeRepository extends JpaRepository<Employee, UUID> {

    @Query("""
            select e.id
              from Employee e
             where e.supervisor.id = :supervisorId
            """)
    List<UUID> findSubordinateIds(@Param("supervisorId") UUID supervisorId);
}
