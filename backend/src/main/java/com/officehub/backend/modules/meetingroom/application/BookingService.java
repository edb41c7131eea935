package com.officehub.backend.modules.meetingroom.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.officehub.backend.global.error.WorkflowException;
import com.officehub.backend.modules.approval.application.ApprovalGate;
import com.officehub.backend.modules.approval.domain.GatedOperation;
import com.officehub.backend.modules.audit.application.AuditLogService;
import com.officehub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.officehub.backend.modules.meetingroom.domain.Booking;
import com.officehub.backend.modules.meetingroom.domain.BookingStatus;
import com.officehub.backend.modules.meetingroom.domain.MeetingRoom;
import com.officehub.backend.modules.meetingroom.infrastructure.persistence.BookingRepository;
import com.officehub.backend.modules.meetingroom.infrastructure.persistence.MeetingRoomRepository;
import com.officehub.backend.modules.meetingroom.presentation.dto.BookingResponse;
import com.officehub.backend.modules.meetingroom.presentation.dto.CreateBookingRequest;
import com.officehub.backend.modules.meetingroom.presentation.dto.MeetingRoomDtoMapper;
import com.officehub.backend.modules.meetingroom.presentation.dto.RoomAvailabilityResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Meeting room reservations over half-open intervals.
 *
 * <p>Create locks the room row, checks for overlapping confirmed bookings and inserts
 * in one transaction. The {@code ex_booking_no_overlap} exclusion constraint rejects
 * anything that gets past the check.</p>
 */
@Service
@Transactional
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    static final String BOOKING_NOT_FOUND = "BOOKING_NOT_FOUND";
    static final String BOOKING_INVALID_STATUS = "BOOKING_INVALID_STATUS";
    static final String BOOKING_CONFLICT = "BOOKING_CONFLICT";
    static final String BOOKING_LIMIT_EXCEEDED = "BOOKING_LIMIT_EXCEEDED";
    static final String INVALID_BOOKING_INTERVAL = "INVALID_BOOKING_INTERVAL";
    static final String NOT_BOOKING_OWNER = "NOT_BOOKING_OWNER";
    private static final String NO_OVERLAP_CONSTRAINT = "ex_booking_no_overlap";
    private static final String RESOURCE_TYPE = "BOOKING";

    private final MeetingRoomRepository meetingRoomRepository;
    private final BookingRepository bookingRepository;
    private final EmployeeRepository employeeRepository;
    private final ApprovalGate approvalGate;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final ZoneId officeZone;
    private final int maxActiveBookingsPerEmployee;

    public BookingService(
            MeetingRoomRepository meetingRoomRepository,
            BookingRepository bookingRepository,
            EmployeeRepository employeeRepository,
            ApprovalGate approvalGate,
            AuditLogService auditLogService,
            Clock clock,
            ZoneId officeZone,
            @Value("${app.meeting-room.max-active-bookings-per-employee:1}") int maxActiveBookingsPerEmployee
    ) {
        this.meetingRoomRepository = meetingRoomRepository;
        this.bookingRepository = bookingRepository;
        this.employeeRepository = employeeRepository;
        this.approvalGate = approvalGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.officeZone = officeZone;
        this.maxActiveBookingsPerEmployee = Math.max(maxActiveBookingsPerEmployee, 0);
    }

    public BookingResponse create(Actor actor, CreateBookingRequest request) {
        approvalGate.require(actor, GatedOperation.BOOKING_CREATE);

        OffsetDateTime startAt = request.startAt();
        OffsetDateTime endAt = request.endAt();
        if (startAt == null || endAt == null) {
            throw WorkflowException.invalidInterval(INVALID_BOOKING_INTERVAL, "startAt and endAt are required");
        }
        if (!endAt.isAfter(startAt)) {
            throw WorkflowException.invalidInterval(INVALID_BOOKING_INTERVAL, "endAt must be after startAt");
        }

        MeetingRoom room = meetingRoomRepository.findByIdForUpdate(request.roomId())
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> WorkflowException.notFound(MeetingRoomService.MEETING_ROOM_NOT_FOUND));

        List<Booking> conflicts = bookingRepository.findConfirmedOverlapping(room.getId(), startAt, endAt);
        if (!conflicts.isEmpty()) {
            Booking existing = conflicts.get(0);
            log.warn("Booking conflict on room={} for [{}, {}) with booking={}",
                    room.getId(), startAt, endAt, existing.getId());
            throw WorkflowException.conflict(BOOKING_CONFLICT, describeConflict(existing));
        }

        if (maxActiveBookingsPerEmployee > 0
                && bookingRepository.countByRequesterIdAndStatus(actor.id(), BookingStatus.CONFIRMED)
                >= maxActiveBookingsPerEmployee) {
            throw WorkflowException.conflict(BOOKING_LIMIT_EXCEEDED,
                    "at most " + maxActiveBookingsPerEmployee + " confirmed bookings per employee");
        }

        Booking booking = new Booking();
        booking.setRoom(room);
        booking.setRequester(employeeRepository.getReferenceById(actor.id()));
        booking.setStartAt(startAt);
        booking.setEndAt(endAt);
        booking.setTitle(StringUtils.hasText(request.title()) ? request.title().trim() : null);
        booking.setStatus(BookingStatus.CONFIRMED);

        Booking saved;
        try {
            saved = bookingRepository.saveAndFlush(booking);
        } catch (DataIntegrityViolationException ex) {
            if (isOverlapViolation(ex)) {
                log.warn("Booking on room={} rejected by exclusion constraint", room.getId());
                throw WorkflowException.conflict(BOOKING_CONFLICT,
                        "room " + room.getId() + " is already booked in [" + startAt + ", " + endAt + ")");
            }
            throw ex;
        }

        Map<String, Object> detail = new HashMap<>();
        detail.put("roomId", room.getId().toString());
        detail.put("startAt", startAt.toString());
        detail.put("endAt", endAt.toString());
        recordTransition("BOOKING_CREATED", saved, actor, null, BookingStatus.CONFIRMED, detail);
        return MeetingRoomDtoMapper.toResponse(saved);
    }

    public BookingResponse cancel(Actor actor, UUID bookingId) {
        approvalGate.require(actor, GatedOperation.BOOKING_CANCEL);
        Booking booking = lockForTransition(bookingId);
        approvalGate.requireOwner(actor, booking.getRequester().getId(), NOT_BOOKING_OWNER);
        requireConfirmed(booking);

        booking.setStatus(BookingStatus.CANCELLED);
        booking.setCancelledAt(OffsetDateTime.now(clock));

        recordTransition("BOOKING_CANCELLED", booking, actor, BookingStatus.CONFIRMED, BookingStatus.CANCELLED, null);
        return MeetingRoomDtoMapper.toResponse(booking);
    }

    public BookingResponse complete(Actor actor, UUID bookingId) {
        approvalGate.require(actor, GatedOperation.BOOKING_COMPLETE);
        Booking booking = lockForTransition(bookingId);
        approvalGate.requireOwner(actor, booking.getRequester().getId(), NOT_BOOKING_OWNER);
        requireConfirmed(booking);

        booking.setStatus(BookingStatus.COMPLETED);
        booking.setCompletedAt(OffsetDateTime.now(clock));

        recordTransition("BOOKING_COMPLETED", booking, actor, BookingStatus.CONFIRMED, BookingStatus.COMPLETED, null);
        return MeetingRoomDtoMapper.toResponse(booking);
    }

    /**
     * Confirmed bookings intersecting the office-zone calendar day, ordered by start.
     */
    @Transactional(readOnly = true)
    public RoomAvailabilityResponse availability(UUID roomId, LocalDate date) {
        MeetingRoom room = meetingRoomRepository.findByIdAndDeletedAtIsNull(roomId)
                .orElseThrow(() -> WorkflowException.notFound(MeetingRoomService.MEETING_ROOM_NOT_FOUND));

        OffsetDateTime dayStart = date.atStartOfDay(officeZone).toOffsetDateTime();
        OffsetDateTime dayEnd = date.plusDays(1).atStartOfDay(officeZone).toOffsetDateTime();
        List<BookingResponse> bookings = bookingRepository.findConfirmedOverlapping(room.getId(), dayStart, dayEnd)
                .stream()
                .map(MeetingRoomDtoMapper::toResponse)
                .toList();
        return new RoomAvailabilityResponse(room.getId(), room.getName(), date, officeZone.getId(), bookings);
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> listMine(Actor actor) {
        return bookingRepository.findByRequesterNewestFirst(actor.id()).stream()
                .map(MeetingRoomDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public BookingResponse get(UUID bookingId) {
        return bookingRepository.findDetailedById(bookingId)
                .map(MeetingRoomDtoMapper::toResponse)
                .orElseThrow(() -> WorkflowException.notFound(BOOKING_NOT_FOUND));
    }

    private Booking lockForTransition(UUID bookingId) {
        UUID roomId = bookingRepository.findRoomIdByBookingId(bookingId)
                .orElseThrow(() -> WorkflowException.notFound(BOOKING_NOT_FOUND));
        meetingRoomRepository.findByIdForUpdate(roomId)
                .orElseThrow(() -> WorkflowException.notFound(MeetingRoomService.MEETING_ROOM_NOT_FOUND));
        return bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> WorkflowException.notFound(BOOKING_NOT_FOUND));
    }

    private void requireConfirmed(Booking booking) {
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            throw WorkflowException.invalidTransition(BOOKING_INVALID_STATUS,
                    "booking " + booking.getId() + " is " + booking.getStatus());
        }
    }

    private void recordTransition(
            String action,
            Booking booking,
            Actor actor,
            BookingStatus from,
            BookingStatus to,
            Map<String, Object> extra
    ) {
        log.info("Booking {} {} -> {} by {}", booking.getId(), from, to, actor.id());

        Map<String, Object> detail = new HashMap<>();
        if (extra != null) {
            detail.putAll(extra);
        }
        detail.put("to", to.name());
        if (from != null) {
            detail.put("from", from.name());
        }
        auditLogService.record(new AuditLogCommand(action, RESOURCE_TYPE, booking.getId(), actor.id(), detail));
    }

    private String describeConflict(Booking existing) {
        String owner = existing.getRequester() != null ? existing.getRequester().getFullName() : null;
        return "conflicts with booking " + existing.getId()
                + (owner != null ? " by " + owner : "")
                + " [" + existing.getStartAt() + ", " + existing.getEndAt() + ")";
    }

    private boolean isOverlapViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(NO_OVERLAP_CONSTRAINT);
    }
}
