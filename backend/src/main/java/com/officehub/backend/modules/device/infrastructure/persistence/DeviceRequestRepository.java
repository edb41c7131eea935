package com.officehub.backend.modules.device.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.officehub.backend.modules.device.domain.DeviceRequest;
import com.officehub.backend.modules.device.domain.DeviceRequestStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeviceRequestRepository extends JpaRepository<DeviceRequest, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from DeviceRequest r where r.id = :id")
    Optional<DeviceRequest> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Unlocked lookup used to find which device row to lock first.
     */
    @Query("select r.device.id from DeviceRequest r where r.id = :id")
    Optional<UUID> findDeviceIdByRequestId(@Param("id") UUID id);

    boolean existsByDeviceIdAndStatusIn(UUID deviceId, Collection<DeviceRequestStatus> statuses);

    @Query("""
            select r
              from DeviceRequest r
              join fetch r.device d
              join fetch r.requester e
             where r.id = :id
            """)
    Optional<DeviceRequest> findDetailedById(@Param("id") UUID id);

    @Query("""
            select r
              from DeviceRequest r
              join fetch r.device d
              join fetch r.requester e
             where e.id = :requesterId
             order by r.requestedAt desc
            """)
    List<DeviceRequest> findByRequesterNewestFirst(@Param("requesterId") UUID requesterId);

    @Query("""
            select r
              from DeviceRequest r
              join fetch r.device d
              join fetch r.requester e
             where r.status = :status
             order by r.requestedAt asc
            """)
    List<DeviceRequest> findByStatusOldestFirst(@Param("status") DeviceRequestStatus status);
}
