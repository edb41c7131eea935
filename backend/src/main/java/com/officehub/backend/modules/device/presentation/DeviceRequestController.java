package com.officehub.backend.modules.device.presentation;

import java.util.List;
import java.util.UUID;

import com.officehub.backend.global.security.SecurityUtils;
import com.officehub.backend.modules.device.application.DeviceRequestService;
import com.officehub.backend.modules.device.presentation.dto.DeviceRequestResponse;
import com.officehub.backend.modules.device.presentation.dto.RejectDeviceRequestRequest;
import com.officehub.backend.modules.device.presentation.dto.SubmitDeviceRequestRequest;
import com.officehub.backend.modules.employee.application.ActorDirectory;
import com.officehub.backend.modules.employee.domain.Actor;

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
@RequestMapping("/device-requests")
public class DeviceRequestController {

    private final DeviceRequestService deviceRequestService;
    private final ActorDirectory actorDirectory;

    public DeviceRequestController(DeviceRequestService deviceRequestService, ActorDirectory actorDirectory) {
        this.deviceRequestService = deviceRequestService;
        this.actorDirectory = actorDirectory;
    }

    @Operation(summary = "기기 대여 신청", description = "직원이 대여 가능한 기기를 신청한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "신청 성공"),
            @ApiResponse(responseCode = "404", description = "기기 없음"),
            @ApiResponse(responseCode = "409", description = "이미 진행 중인 신청 존재")
    })
    @PostMapping
    public ResponseEntity<DeviceRequestResponse> create(@Valid @RequestBody SubmitDeviceRequestRequest request) {
        DeviceRequestResponse response = deviceRequestService.create(currentActor(), request.deviceId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "내 기기 신청 목록")
    @GetMapping
    public ResponseEntity<List<DeviceRequestResponse>> listMine() {
        return ResponseEntity.ok(deviceRequestService.listMine(currentActor()));
    }

    @Operation(summary = "승인 대기 신청 목록", description = "기기 관리자가 승인 대기 중인 신청을 확인한다.")
    @GetMapping("/pending")
    public ResponseEntity<List<DeviceRequestResponse>> listPending() {
        return ResponseEntity.ok(deviceRequestService.listPending(currentActor()));
    }

    @Operation(summary = "반납 대기 신청 목록")
    @GetMapping("/return-pending")
    public ResponseEntity<List<DeviceRequestResponse>> listReturnPending() {
        return ResponseEntity.ok(deviceRequestService.listReturnPending(currentActor()));
    }

    @Operation(summary = "기기 신청 상세 조회", description = "신청자 본인 또는 기기 관리자만 조회할 수 있다.")
    @GetMapping("/{requestId}")
    public ResponseEntity<DeviceRequestResponse> get(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(deviceRequestService.get(currentActor(), requestId));
    }

    @Operation(summary = "기기 신청 승인")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "승인 성공"),
            @ApiResponse(responseCode = "400", description = "승인할 수 없는 상태"),
            @ApiResponse(responseCode = "403", description = "기기 관리자 권한 필요"),
            @ApiResponse(responseCode = "404", description = "신청 없음")
    })
    @PutMapping("/{requestId}/approve")
    public ResponseEntity<DeviceRequestResponse> approve(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(deviceRequestService.approve(currentActor(), requestId));
    }

    @Operation(summary = "기기 신청 반려")
    @PutMapping("/{requestId}/reject")
    public ResponseEntity<DeviceRequestResponse> reject(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody(required = false) RejectDeviceRequestRequest request
    ) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(deviceRequestService.reject(currentActor(), requestId, reason));
    }

    @Operation(summary = "기기 수령 확인", description = "승인된 신청의 신청자가 기기를 수령한다.")
    @PutMapping("/{requestId}/collect")
    public ResponseEntity<DeviceRequestResponse> collect(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(deviceRequestService.collect(currentActor(), requestId));
    }

    @Operation(summary = "기기 반납 요청")
    @PutMapping("/{requestId}/return")
    public ResponseEntity<DeviceRequestResponse> initiateReturn(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(deviceRequestService.initiateReturn(currentActor(), requestId));
    }

    @Operation(summary = "기기 반납 확인", description = "기기 관리자가 반납을 확인하면 기기가 다시 대여 가능 상태가 된다.")
    @PutMapping("/{requestId}/confirm-return")
    public ResponseEntity<DeviceRequestResponse> confirmReturn(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(deviceRequestService.confirmReturn(currentActor(), requestId));
    }

    @Operation(summary = "기기 신청 취소", description = "신청자가 승인 전후(수령 전) 신청을 취소한다.")
    @PutMapping("/{requestId}/cancel")
    public ResponseEntity<DeviceRequestResponse> cancel(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(deviceRequestService.cancel(currentActor(), requestId));
    }

    private Actor currentActor() {
        return actorDirectory.resolve(SecurityUtils.getCurrentEmployeeId());
    }
}
