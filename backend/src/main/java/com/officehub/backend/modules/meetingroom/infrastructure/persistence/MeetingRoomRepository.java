package com.officehub.backend.modules.meetingroom.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.officehub.backend.modules.meetingroom.domain.MeetingRoom;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MeetingRoomRepository extends JpaRepository<MeetingRoom, UUID> {

    List<MeetingRoom> findByDeletedAtIsNullOrderByNameAsc();

    Optional<MeetingRoom> findByIdAndDeletedAtIsNull(UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from MeetingRoom r where r.id = :id")
    Optional<MeetingRoom> findByIdForUpdate(@Param("id") UUID id);
}
