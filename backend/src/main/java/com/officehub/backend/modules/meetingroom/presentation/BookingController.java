package com.officehub.backend.modules.meetingroom.presentation;

import java.util.List;
import java.util.UUID;

import com.officehub.backend.global.security.SecurityUtils;
import com.officehub.backend.modules.employee.application.ActorDirectory;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.meetingroom.application.BookingService;
import com.officehub.backend.modules.meetingroom.presentation.dto.BookingResponse;
import com.officehub.backend.modules.meetingroom.presentation.dto.CreateBookingRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/meeting-room-bookings")
public class BookingController {

    private final BookingService bookingService;
    private final ActorDirectory actorDirectory;

    public BookingController(BookingService bookingService, ActorDirectory actorDirectory) {
        this.bookingService = bookingService;
        this.actorDirectory = actorDirectory;
    }

    @Operation(summary = "회의실 예약", description = "[startAt, endAt) 구간으로 회의실을 예약한다. 경계가 맞닿는 예약은 충돌하지 않는다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "예약 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 예약 구간"),
            @ApiResponse(responseCode = "404", description = "회의실 없음"),
            @ApiResponse(responseCode = "409", description = "기존 예약과 시간 충돌")
    })
    @PostMapping
    public ResponseEntity<BookingResponse> create(@Valid @RequestBody CreateBookingRequest request) {
        BookingResponse response = bookingService.create(currentActor(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "내 예약 목록")
    @GetMapping
    public ResponseEntity<List<BookingResponse>> listMine() {
        return ResponseEntity.ok(bookingService.listMine(currentActor()));
    }

    @Operation(summary = "예약 상세 조회")
    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingResponse> get(@PathVariable("bookingId") UUID bookingId) {
        return ResponseEntity.ok(bookingService.get(bookingId));
    }

    @Operation(summary = "회의 종료 처리")
    @PutMapping("/{bookingId}/complete")
    public ResponseEntity<BookingResponse> complete(@PathVariable("bookingId") UUID bookingId) {
        return ResponseEntity.ok(bookingService.complete(currentActor(), bookingId));
    }

    @Operation(summary = "예약 취소", description = "예약자 본인만 확정 상태의 예약을 취소할 수 있다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "취소 성공"),
            @ApiResponse(responseCode = "400", description = "취소할 수 없는 상태"),
            @ApiResponse(responseCode = "403", description = "예약자 본인 아님"),
            @ApiResponse(responseCode = "404", description = "예약 없음")
    })
    @PutMapping("/{bookingId}/cancel")
    public ResponseEntity<BookingResponse> cancel(@PathVariable("bookingId") UUID bookingId) {
        return ResponseEntity.ok(bookingService.cancel(currentActor(), bookingId));
    }

    private Actor currentActor() {
        return actorDirectory.resolve(SecurityUtils.getCurrentEmployeeId());
    }
}
