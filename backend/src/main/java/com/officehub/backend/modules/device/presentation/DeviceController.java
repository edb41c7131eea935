package com.officehub.backend.modules.device.presentation;

import java.util.List;
import java.util.UUID;

import com.officehub.backend.global.security.SecurityUtils;
import com.officehub.backend.modules.device.application.DeviceService;
import com.officehub.backend.modules.device.presentation.dto.CreateDeviceRequest;
import com.officehub.backend.modules.device.presentation.dto.DeviceResponse;
import com.officehub.backend.modules.device.presentation.dto.UpdateDeviceRequest;
import com.officehub.backend.modules.employee.application.ActorDirectory;
import com.officehub.backend.modules.employee.domain.Actor;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/devices")
public class DeviceController {

    private final DeviceService deviceService;
    private final ActorDirectory actorDirectory;

    public DeviceController(DeviceService deviceService, ActorDirectory actorDirectory) {
        this.deviceService = deviceService;
        this.actorDirectory = actorDirectory;
    }

    @Operation(summary = "기기 목록 조회", description = "삭제되지 않은 전체 기기를 이름순으로 반환한다.")
    @GetMapping
    public ResponseEntity<List<DeviceResponse>> listDevices() {
        return ResponseEntity.ok(deviceService.listDevices());
    }

    @Operation(summary = "대여 가능 기기 조회")
    @GetMapping("/available")
    public ResponseEntity<List<DeviceResponse>> listAvailableDevices() {
        return ResponseEntity.ok(deviceService.listAvailableDevices());
    }

    @Operation(summary = "기기 상세 조회")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "기기 없음")
    })
    @GetMapping("/{deviceId}")
    public ResponseEntity<DeviceResponse> getDevice(@PathVariable("deviceId") UUID deviceId) {
        return ResponseEntity.ok(deviceService.getDevice(deviceId));
    }

    @Operation(summary = "기기 등록", description = "기기 관리자가 새 기기를 등록한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "등록 성공"),
            @ApiResponse(responseCode = "403", description = "기기 관리자 권한 필요")
    })
    @PostMapping
    public ResponseEntity<DeviceResponse> createDevice(@Valid @RequestBody CreateDeviceRequest request) {
        DeviceResponse response = deviceService.createDevice(currentActor(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "기기 정보 수정")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "수정 성공"),
            @ApiResponse(responseCode = "403", description = "기기 관리자 권한 필요"),
            @ApiResponse(responseCode = "404", description = "기기 없음")
    })
    @PutMapping("/{deviceId}")
    public ResponseEntity<DeviceResponse> updateDevice(
            @PathVariable("deviceId") UUID deviceId,
            @Valid @RequestBody UpdateDeviceRequest request
    ) {
        return ResponseEntity.ok(deviceService.updateDevice(currentActor(), deviceId, request));
    }

    @Operation(summary = "기기 삭제", description = "진행 중인 신청이 없는 기기만 삭제(soft delete)할 수 있다.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "삭제 성공"),
            @ApiResponse(responseCode = "403", description = "기기 관리자 권한 필요"),
            @ApiResponse(responseCode = "404", description = "기기 없음"),
            @ApiResponse(responseCode = "409", description = "진행 중인 신청 존재")
    })
    @DeleteMapping("/{deviceId}")
    public ResponseEntity<Void> deleteDevice(@PathVariable("deviceId") UUID deviceId) {
        deviceService.deleteDevice(currentActor(), deviceId);
        return ResponseEntity.noContent().build();
    }

    private Actor currentActor() {
        return actorDirectory.resolve(SecurityUtils.getCurrentEmployeeId());
    }
}
