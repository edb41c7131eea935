package com.officehub.backend.modules.meetingroom.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.officehub.backend.global.security.SecurityUtils;
import com.officehub.backend.modules.employee.application.ActorDirectory;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.meetingroom.application.BookingService;
import com.officehub.backend.modules.meetingroom.application.MeetingRoomService;
import com.officehub.backend.modules.meetingroom.presentation.dto.CreateMeetingRoomRequest;
import com.officehub.backend.modules.meetingroom.presentation.dto.MeetingRoomResponse;
import com.officehub.backend.modules.meetingroom.presentation.dto.RoomAvailabilityResponse;
import com.officehub.backend.modules.meetingroom.presentation.dto.UpdateMeetingRoomRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/meeting-rooms")
public class MeetingRoomController {

    private final MeetingRoomService meetingRoomService;
    private final BookingService bookingService;
    private final ActorDirectory actorDirectory;

    public MeetingRoomController(
            MeetingRoomService meetingRoomService,
            BookingService bookingService,
            ActorDirectory actorDirectory
    ) {
        this.meetingRoomService = meetingRoomService;
        this.bookingService = bookingService;
        this.actorDirectory = actorDirectory;
    }

    @Operation(summary = "회의실 목록 조회")
    @GetMapping
    public ResponseEntity<List<MeetingRoomResponse>> listRooms() {
        return ResponseEntity.ok(meetingRoomService.listRooms());
    }

    @Operation(summary = "회의실 상세 조회")
    @GetMapping("/{roomId}")
    public ResponseEntity<MeetingRoomResponse> getRoom(@PathVariable("roomId") UUID roomId) {
        return ResponseEntity.ok(meetingRoomService.getRoom(roomId));
    }

    @Operation(summary = "회의실 일자별 예약 현황", description = "지정한 날짜(사무실 시간대 기준)에 걸친 확정 예약을 시작 시각순으로 반환한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "회의실 없음")
    })
    @GetMapping("/{roomId}/availability")
    public ResponseEntity<RoomAvailabilityResponse> availability(
            @PathVariable("roomId") UUID roomId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(bookingService.availability(roomId, date));
    }

    @Operation(summary = "회의실 등록", description = "최고 관리자만 회의실을 등록할 수 있다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "등록 성공"),
            @ApiResponse(responseCode = "403", description = "최고 관리자 권한 필요")
    })
    @PostMapping
    public ResponseEntity<MeetingRoomResponse> createRoom(@Valid @RequestBody CreateMeetingRoomRequest request) {
        MeetingRoomResponse response = meetingRoomService.createRoom(currentActor(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "회의실 정보 수정")
    @PutMapping("/{roomId}")
    public ResponseEntity<MeetingRoomResponse> updateRoom(
            @PathVariable("roomId") UUID roomId,
            @Valid @RequestBody UpdateMeetingRoomRequest request
    ) {
        return ResponseEntity.ok(meetingRoomService.updateRoom(currentActor(), roomId, request));
    }

    @Operation(summary = "회의실 삭제")
    @DeleteMapping("/{roomId}")
    public ResponseEntity<Void> deleteRoom(@PathVariable("roomId") UUID roomId) {
        meetingRoomService.deleteRoom(currentActor(), roomId);
        return ResponseEntity.noContent().build();
    }

    private Actor currentActor() {
        return actorDirectory.resolve(SecurityUtils.getCurrentEmployeeId());
    }
}
