package com.officehub.backend.modules.leave.presentation;

import java.util.List;
import java.util.UUID;

import com.officehub.backend.global.security.SecurityUtils;
import com.officehub.backend.modules.employee.application.ActorDirectory;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.leave.application.LeaveService;
import com.officehub.backend.modules.leave.presentation.dto.CreateLeaveRequest;
import com.officehub.backend.modules.leave.presentation.dto.LeaveResponse;
import com.officehub.backend.modules.leave.presentation.dto.RejectLeaveRequest;

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
@RequestMapping("/leaves")
public class LeaveController {

    private final LeaveService leaveService;
    private final ActorDirectory actorDirectory;

    public LeaveController(LeaveService leaveService, ActorDirectory actorDirectory) {
        this.leaveService = leaveService;
        this.actorDirectory = actorDirectory;
    }

    @Operation(summary = "휴가 신청")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "신청 성공"),
            @ApiResponse(responseCode = "400", description = "종료일이 시작일보다 빠름")
    })
    @PostMapping
    public ResponseEntity<LeaveResponse> create(@Valid @RequestBody CreateLeaveRequest request) {
        LeaveResponse response = leaveService.create(currentActor(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "내 휴가 신청 목록")
    @GetMapping
    public ResponseEntity<List<LeaveResponse>> listMine() {
        return ResponseEntity.ok(leaveService.listMine(currentActor()));
    }

    @Operation(summary = "결재 대기 휴가 목록", description = "직속 부하 직원의 대기 중인 휴가 신청을 조회한다.")
    @GetMapping("/pending")
    public ResponseEntity<List<LeaveResponse>> listPending() {
        return ResponseEntity.ok(leaveService.listPendingForSupervisor(currentActor()));
    }

    @Operation(summary = "휴가 승인")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "승인 성공"),
            @ApiResponse(responseCode = "400", description = "대기 상태가 아님"),
            @ApiResponse(responseCode = "403", description = "직속 상사가 아니거나 본인 신청"),
            @ApiResponse(responseCode = "404", description = "신청 없음")
    })
    @PutMapping("/{leaveId}/approve")
    public ResponseEntity<LeaveResponse> approve(@PathVariable("leaveId") UUID leaveId) {
        return ResponseEntity.ok(leaveService.approve(currentActor(), leaveId));
    }

    @Operation(summary = "휴가 반려")
    @PutMapping("/{leaveId}/reject")
    public ResponseEntity<LeaveResponse> reject(
            @PathVariable("leaveId") UUID leaveId,
            @Valid @RequestBody(required = false) RejectLeaveRequest request
    ) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(leaveService.reject(currentActor(), leaveId, reason));
    }

    @Operation(summary = "휴가 취소", description = "신청자 본인 또는 직속 상사가 대기 중인 신청을 취소한다.")
    @PutMapping("/{leaveId}/cancel")
    public ResponseEntity<LeaveResponse> cancel(@PathVariable("leaveId") UUID leaveId) {
        return ResponseEntity.ok(leaveService.cancel(currentActor(), leaveId));
    }

    private Actor currentActor() {
        return actorDirectory.resolve(SecurityUtils.getCurrentEmployeeId());
    }
}
