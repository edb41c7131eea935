package com.officehub.backend.modules.meetingroom.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.officehub.backend.global.error.WorkflowException;
import com.officehub.backend.modules.approval.application.ApprovalGate;
import com.officehub.backend.modules.approval.domain.GatedOperation;
import com.officehub.backend.modules.audit.application.AuditLogService;
import com.officehub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.meetingroom.domain.MeetingRoom;
import com.officehub.backend.modules.meetingroom.infrastructure.persistence.MeetingRoomRepository;
import com.officehub.backend.modules.meetingroom.presentation.dto.CreateMeetingRoomRequest;
import com.officehub.backend.modules.meetingroom.presentation.dto.MeetingRoomDtoMapper;
import com.officehub.backend.modules.meetingroom.presentation.dto.MeetingRoomResponse;
import com.officehub.backend.modules.meetingroom.presentation.dto.UpdateMeetingRoomRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class MeetingRoomService {

    static final String MEETING_ROOM_NOT_FOUND = "MEETING_ROOM_NOT_FOUND";

    private final MeetingRoomRepository meetingRoomRepository;
    private final ApprovalGate approvalGate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public MeetingRoomService(
            MeetingRoomRepository meetingRoomRepository,
            ApprovalGate approvalGate,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.meetingRoomRepository = meetingRoomRepository;
        this.approvalGate = approvalGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<MeetingRoomResponse> listRooms() {
        return meetingRoomRepository.findByDeletedAtIsNullOrderByNameAsc().stream()
                .map(MeetingRoomDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public MeetingRoomResponse getRoom(UUID roomId) {
        return MeetingRoomDtoMapper.toResponse(loadLiveRoom(roomId));
    }

    public MeetingRoomResponse createRoom(Actor actor, CreateMeetingRoomRequest request) {
        approvalGate.require(actor, GatedOperation.MEETING_ROOM_MANAGE);

        MeetingRoom room = new MeetingRoom();
        room.setName(request.name().trim());
        room.setCapacity(request.capacity());
        room.setLocation(StringUtils.hasText(request.location()) ? request.location().trim() : null);
        MeetingRoom saved = meetingRoomRepository.save(room);

        auditLogService.record(new AuditLogCommand(
                "MEETING_ROOM_CREATED", "MEETING_ROOM", saved.getId(), actor.id(), Map.of("name", saved.getName())));
        return MeetingRoomDtoMapper.toResponse(saved);
    }

    public MeetingRoomResponse updateRoom(Actor actor, UUID roomId, UpdateMeetingRoomRequest request) {
        approvalGate.require(actor, GatedOperation.MEETING_ROOM_MANAGE);
        MeetingRoom room = loadLiveRoom(roomId);

        if (StringUtils.hasText(request.name())) {
            room.setName(request.name().trim());
        }
        if (request.capacity() != null) {
            room.setCapacity(request.capacity());
        }
        if (StringUtils.hasText(request.location())) {
            room.setLocation(request.location().trim());
        }

        auditLogService.record(new AuditLogCommand(
                "MEETING_ROOM_UPDATED", "MEETING_ROOM", room.getId(), actor.id(), null));
        return MeetingRoomDtoMapper.toResponse(room);
    }

    public void deleteRoom(Actor actor, UUID roomId) {
        approvalGate.require(actor, GatedOperation.MEETING_ROOM_MANAGE);
        MeetingRoom room = meetingRoomRepository.findByIdForUpdate(roomId)
                .filter(candidate -> !candidate.isDeleted())
                .orElseThrow(() -> WorkflowException.notFound(MEETING_ROOM_NOT_FOUND));
        room.setDeletedAt(OffsetDateTime.now(clock));

        auditLogService.record(new AuditLogCommand(
                "MEETING_ROOM_DELETED", "MEETING_ROOM", room.getId(), actor.id(), null));
    }

    private MeetingRoom loadLiveRoom(UUID roomId) {
        return meetingRoomRepository.findByIdAndDeletedAtIsNull(roomId)
                .orElseThrow(() -> WorkflowException.notFound(MEETING_ROOM_NOT_FOUND));
    }
}
