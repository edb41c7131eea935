package com.officehub.backend.modules.meetingroom.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.officehub.backend.modules.meetingroom.domain.Booking;
import com.officehub.backend.modules.meetingroom.domain.BookingStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BookingRepository extends JpaRepository<Booking, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Booking b where b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") UUID id);

    @Query("select b.room.id from Booking b where b.id = :id")
    Optional<UUID> findRoomIdByBookingId(@Param("id") UUID id);

    /**
     * Confirmed bookings of a room sharing any instant with [start, end).
     */
    @Query("""
            select b
              from Booking b
              join fetch b.requester e
             where b.room.id = :roomId
               and b.status = com.officehub.backend.modules.meetingroom.domain.BookingStatus.CONFIRMED
               and b.startAt < :end
               and b.endAt > :start
             order by b.startAt asc
            """)
    List<Booking> findConfirmedOverlapping(
            @Param("roomId") UUID roomId,
            @Param("start") OffsetDateTime start,
            @Param("end") OffsetDateTime end
    );

    long countByRequesterIdAndStatus(UUID requesterId, BookingStatus status);

    @Query("""
            select b
              from Booking b
              join fetch b.room r
              join fetch b.requester e
             where b.id = :id
            """)
    Optional<Booking> findDetailedById(@Param("id") UUID id);

    @Query("""
            select b
              from Booking b
              join fetch b.room r
              join fetch b.requester e
             where e.id = :requesterId
             order by b.startAt desc
            """)
    List<Booking> findByRequesterNewestFirst(@Param("requesterId") UUID requesterId);
}
