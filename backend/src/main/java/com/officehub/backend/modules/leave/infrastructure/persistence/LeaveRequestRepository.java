package com.officehub.backend.modules.leave.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.officehub.backend.modules.leave.domain.LeaveRequest;
import com.officehub.backend.modules.leave.domain.LeaveStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from LeaveRequest l where l.id = :id")
    Optional<LeaveRequest> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select l
              from LeaveRequest l
              join fetch l.requester e
             where e.id = :requesterId
             order by l.startDate desc, l.createdAt desc
            """)
    List<LeaveRequest> findByRequesterNewestFirst(@Param("requesterId") UUID requesterId);

    @Query("""
            select l
              from LeaveRequest l
              join fetch l.requester e
             where l.status = :status
               and e.id in :requesterIds
             order by l.startDate asc
            """)
    List<LeaveRequest> findByStatusAndRequesterIdIn(
            @Param("status") LeaveStatus status,
            @Param("requesterIds") Collection<UUID> requesterIds
    );

    @Query("""
            select l
              from LeaveRequest l
              join fetch l.requester e
             where l.status = :status
             order by l.startDate asc
            """)
    List<LeaveRequest> findAllByStatus(@Param("status") LeaveStatus status);
}
