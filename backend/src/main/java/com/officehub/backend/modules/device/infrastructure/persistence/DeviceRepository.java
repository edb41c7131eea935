package com.officehub.backend.modules.device.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.officehub.backend.modules.device.domain.Device;
import com.officehub.backend.modules.device.domain.DeviceStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeviceRepository extends JpaRepository<Device, UUID> {

    List<Device> findByDeletedAtIsNullOrderByNameAsc();

    List<Device> findByStatusAndDeletedAtIsNullOrderByNameAsc(DeviceStatus status);

    Optional<Device> findByIdAndDeletedAtIsNull(UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from Device d where d.id = :id")
    Optional<Device> findByIdForUpdate(@Param("id") UUID id);
}
