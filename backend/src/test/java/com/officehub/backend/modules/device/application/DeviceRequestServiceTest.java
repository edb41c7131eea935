package com.officehub.backend.modules.device.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.officehub.backend.global.error.ErrorKind;
import com.officehub.backend.global.error.WorkflowException;
import com.officehub.backend.modules.approval.application.ApprovalGate;
import com.officehub.backend.modules.audit.application.AuditLogService;
import com.officehub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.officehub.backend.modules.device.domain.Device;
import com.officehub.backend.modules.device.domain.DeviceRequest;
import com.officehub.backend.modules.device.domain.DeviceRequestStatus;
import com.officehub.backend.modules.device.domain.DeviceStatus;
import com.officehub.backend.modules.device.infrastructure.persistence.DeviceRepository;
import com.officehub.backend.modules.device.infrastructure.persistence.DeviceRequestRepository;
import com.officehub.backend.modules.device.presentation.dto.DeviceRequestResponse;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.employee.domain.Employee;
import com.officehub.backend.modules.employee.domain.EmployeeRole;
import com.officehub.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.officehub.backend.support.EntityIds;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class DeviceRequestServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-01-10T09:00:00Z");

    @Mock
    private DeviceRepository deviceRepository;

    @Mock
    private DeviceRequestRepository deviceRequestRepository;

    @Mock
    private EmployeeRepository employeeRepository;

    @Mock
    private AuditLogService auditLogService;

    private DeviceRequestService deviceRequestService;

    private Employee requester;
    private Employee deviceAdmin;
    private Device device;
    private Actor requesterActor;
    private Actor adminActor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        deviceRequestService = new DeviceRequestService(
                deviceRepository,
                deviceRequestRepository,
                employeeRepository,
                new ApprovalGate(),
                auditLogService,
                clock
        );

        requester = employee("erin", EmployeeRole.EMPLOYEE);
        deviceAdmin = employee("devon", EmployeeRole.DEVICE_ADMIN);
        requesterActor = new Actor(requester.getId(), EmployeeRole.EMPLOYEE, null, true);
        adminActor = new Actor(deviceAdmin.getId(), EmployeeRole.DEVICE_ADMIN, null, true);

        device = new Device();
        device.setName("MacBook Pro 14");
        device.setType("laptop");
        device.setStatus(DeviceStatus.AVAILABLE);
        EntityIds.assign(device, UUID.randomUUID());
    }

    @Test
    @DisplayName("신청 생성 시 PENDING 상태가 되고 기기는 UNDER_REQUEST 로 바뀐다")
    void createMarksDeviceUnderRequest() {
        when(deviceRepository.findByIdForUpdate(device.getId())).thenReturn(Optional.of(device));
        when(deviceRequestRepository.existsByDeviceIdAndStatusIn(device.getId(), DeviceRequestStatus.ACTIVE))
                .thenReturn(false);
        when(employeeRepository.getReferenceById(requester.getId())).thenReturn(requester);
        when(deviceRequestRepository.saveAndFlush(any(DeviceRequest.class)))
                .thenAnswer(invocation -> EntityIds.assign(invocation.getArgument(0), UUID.randomUUID()));

        DeviceRequestResponse response = deviceRequestService.create(requesterActor, device.getId());

        assertThat(response.status()).isEqualTo("PENDING");
        assertThat(response.requesterId()).isEqualTo(requester.getId());
        assertThat(response.requestedAt()).isEqualTo(NOW);
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.UNDER_REQUEST);

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().actionType()).isEqualTo("DEVICE_REQUEST_CREATED");
        assertThat(audit.getValue().actorId()).isEqualTo(requester.getId());
    }

    @Test
    void createFailsWithConflictWhileAnotherRequestIsActive() {
        device.setStatus(DeviceStatus.UNDER_REQUEST);
        when(deviceRepository.findByIdForUpdate(device.getId())).thenReturn(Optional.of(device));
        when(deviceRequestRepository.existsByDeviceIdAndStatusIn(device.getId(), DeviceRequestStatus.ACTIVE))
                .thenReturn(true);

        assertThatThrownBy(() -> deviceRequestService.create(requesterActor, device.getId()))
                .isInstanceOfSatisfying(WorkflowException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo(DeviceService.DEVICE_HAS_ACTIVE_REQUEST);
                });
        verify(deviceRequestRepository, never()).saveAndFlush(any());
        verifyNoInteractions(auditLogService);
    }

    @Test
    @DisplayName("부분 유니크 인덱스 위반은 CONFLICT 로 변환된다")
    void uniqueIndexViolationBecomesConflict() {
        when(deviceRepository.findByIdForUpdate(device.getId())).thenReturn(Optional.of(device));
        when(deviceRequestRepository.existsByDeviceIdAndStatusIn(device.getId(), DeviceRequestStatus.ACTIVE))
                .thenReturn(false);
        when(employeeRepository.getReferenceById(requester.getId())).thenReturn(requester);
        when(deviceRequestRepository.saveAndFlush(any(DeviceRequest.class)))
                .thenThrow(new DataIntegrityViolationException("could not execute statement",
                        new IllegalStateException(
                                "duplicate key value violates unique constraint \"uq_device_request_active\"")));

        assertThatThrownBy(() -> deviceRequestService.create(requesterActor, device.getId()))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.CONFLICT));
        verifyNoInteractions(auditLogService);
    }

    @Test
    void unrelatedIntegrityViolationIsPropagated() {
        when(deviceRepository.findByIdForUpdate(device.getId())).thenReturn(Optional.of(device));
        when(deviceRequestRepository.existsByDeviceIdAndStatusIn(device.getId(), DeviceRequestStatus.ACTIVE))
                .thenReturn(false);
        when(employeeRepository.getReferenceById(requester.getId())).thenReturn(requester);
        DataIntegrityViolationException failure = new DataIntegrityViolationException("fk_device_request_requester");
        when(deviceRequestRepository.saveAndFlush(any(DeviceRequest.class))).thenThrow(failure);

        assertThatThrownBy(() -> deviceRequestService.create(requesterActor, device.getId())).isSameAs(failure);
    }

    @Test
    void createOnDeletedDeviceIsNotFound() {
        device.setDeletedAt(NOW.minusDays(1));
        when(deviceRepository.findByIdForUpdate(device.getId())).thenReturn(Optional.of(device));

        assertThatThrownBy(() -> deviceRequestService.create(requesterActor, device.getId()))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    @DisplayName("일반 직원의 승인 시도는 상태를 읽기 전에 거부된다")
    void employeeApprovalIsForbiddenBeforeAnyLookup() {
        UUID requestId = UUID.randomUUID();

        assertThatThrownBy(() -> deviceRequestService.approve(requesterActor, requestId))
                .isInstanceOfSatisfying(WorkflowException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo(ApprovalGate.ROLE_NOT_PERMITTED);
                });
        verifyNoInteractions(deviceRequestRepository, deviceRepository, auditLogService);
    }

    @Test
    void deviceAdminApprovesPendingRequest() {
        DeviceRequest request = request(DeviceRequestStatus.PENDING);
        stubLocked(request);
        when(employeeRepository.getReferenceById(deviceAdmin.getId())).thenReturn(deviceAdmin);

        DeviceRequestResponse response = deviceRequestService.approve(adminActor, request.getId());

        assertThat(response.status()).isEqualTo("APPROVED");
        assertThat(response.decidedBy()).isEqualTo(deviceAdmin.getId());
        assertThat(response.decidedAt()).isEqualTo(NOW);
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.UNDER_REQUEST);
    }

    @Test
    @DisplayName("승인부터 반납 확인까지 전체 흐름")
    void fullBorrowLifecycle() {
        DeviceRequest request = request(DeviceRequestStatus.PENDING);
        stubLocked(request);
        when(employeeRepository.getReferenceById(deviceAdmin.getId())).thenReturn(deviceAdmin);

        deviceRequestService.approve(adminActor, request.getId());
        deviceRequestService.collect(requesterActor, request.getId());
        assertThat(request.getStatus()).isEqualTo(DeviceRequestStatus.COLLECTED);
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.BORROWED);

        deviceRequestService.initiateReturn(requesterActor, request.getId());
        assertThat(request.getStatus()).isEqualTo(DeviceRequestStatus.RETURN_PENDING);
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.BORROWED);

        DeviceRequestResponse returned = deviceRequestService.confirmReturn(adminActor, request.getId());
        assertThat(returned.status()).isEqualTo("RETURNED");
        assertThat(returned.returnConfirmedBy()).isEqualTo(deviceAdmin.getId());
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.AVAILABLE);

        verify(auditLogService, times(4)).record(any(AuditLogCommand.class));
    }

    @Test
    void rejectFreesDeviceAndKeepsReason() {
        DeviceRequest request = request(DeviceRequestStatus.PENDING);
        stubLocked(request);
        when(employeeRepository.getReferenceById(deviceAdmin.getId())).thenReturn(deviceAdmin);

        DeviceRequestResponse response = deviceRequestService.reject(adminActor, request.getId(), "  out of budget ");

        assertThat(response.status()).isEqualTo("REJECTED");
        assertThat(response.rejectReason()).isEqualTo("out of budget");
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.AVAILABLE);
    }

    @Test
    @DisplayName("종료 상태에서 다시 반려하면 INVALID_TRANSITION 이고 상태는 그대로다")
    void terminalRequestRejectsFurtherTransitions() {
        DeviceRequest request = request(DeviceRequestStatus.PENDING);
        stubLocked(request);
        when(employeeRepository.getReferenceById(deviceAdmin.getId())).thenReturn(deviceAdmin);

        deviceRequestService.reject(adminActor, request.getId(), null);
        OffsetDateTime decidedAt = request.getDecidedAt();

        assertThatThrownBy(() -> deviceRequestService.reject(adminActor, request.getId(), "again"))
                .isInstanceOfSatisfying(WorkflowException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_TRANSITION);
                    assertThat(ex.getCode()).isEqualTo(DeviceRequestService.DEVICE_REQUEST_INVALID_STATUS);
                });
        assertThat(request.getStatus()).isEqualTo(DeviceRequestStatus.REJECTED);
        assertThat(request.getRejectReason()).isNull();
        assertThat(request.getDecidedAt()).isEqualTo(decidedAt);
        verify(auditLogService, times(1)).record(any(AuditLogCommand.class));
    }

    @Test
    void onlyRequesterMayCollect() {
        DeviceRequest request = request(DeviceRequestStatus.APPROVED);
        stubLocked(request);
        Actor someoneElse = new Actor(UUID.randomUUID(), EmployeeRole.EMPLOYEE, null, true);

        assertThatThrownBy(() -> deviceRequestService.collect(someoneElse, request.getId()))
                .isInstanceOfSatisfying(WorkflowException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo(DeviceRequestService.NOT_REQUEST_OWNER);
                });
        assertThat(request.getStatus()).isEqualTo(DeviceRequestStatus.APPROVED);
    }

    @Test
    void requesterMayCancelApprovedRequest() {
        DeviceRequest request = request(DeviceRequestStatus.APPROVED);
        stubLocked(request);

        DeviceRequestResponse response = deviceRequestService.cancel(requesterActor, request.getId());

        assertThat(response.status()).isEqualTo("CANCELLED");
        assertThat(response.cancelledAt()).isEqualTo(NOW);
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.AVAILABLE);
    }

    @Test
    @DisplayName("취소된 신청은 승인, 수령, 재취소 모두 INVALID_TRANSITION")
    void cancelledRequestRejectsFurtherTransitions() {
        DeviceRequest request = request(DeviceRequestStatus.PENDING);
        stubLocked(request);

        deviceRequestService.cancel(requesterActor, request.getId());
        OffsetDateTime cancelledAt = request.getCancelledAt();

        assertThatThrownBy(() -> deviceRequestService.approve(adminActor, request.getId()))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_TRANSITION));
        assertThatThrownBy(() -> deviceRequestService.collect(requesterActor, request.getId()))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_TRANSITION));
        assertThatThrownBy(() -> deviceRequestService.cancel(requesterActor, request.getId()))
                .isInstanceOfSatisfying(WorkflowException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_TRANSITION);
                    assertThat(ex.getCode()).isEqualTo(DeviceRequestService.DEVICE_REQUEST_INVALID_STATUS);
                });

        assertThat(request.getStatus()).isEqualTo(DeviceRequestStatus.CANCELLED);
        assertThat(request.getCancelledAt()).isEqualTo(cancelledAt);
        assertThat(request.getDecidedBy()).isNull();
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.AVAILABLE);
        verify(auditLogService, times(1)).record(any(AuditLogCommand.class));
    }

    @Test
    @DisplayName("관리자는 대기 신청을 취소하지 못하고 반려로 처리한다")
    void adminStopsPendingRequestByRejectingNotCancelling() {
        DeviceRequest request = request(DeviceRequestStatus.PENDING);
        stubLocked(request);
        when(employeeRepository.getReferenceById(deviceAdmin.getId())).thenReturn(deviceAdmin);

        assertThatThrownBy(() -> deviceRequestService.cancel(adminActor, request.getId()))
                .isInstanceOfSatisfying(WorkflowException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo(DeviceRequestService.NOT_REQUEST_OWNER);
                });
        assertThat(request.getStatus()).isEqualTo(DeviceRequestStatus.PENDING);

        DeviceRequestResponse rejected = deviceRequestService.reject(adminActor, request.getId(), null);

        assertThat(rejected.status()).isEqualTo("REJECTED");
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.AVAILABLE);
    }

    @Test
    void collectedRequestCannotBeCancelled() {
        DeviceRequest request = request(DeviceRequestStatus.COLLECTED);
        stubLocked(request);

        assertThatThrownBy(() -> deviceRequestService.cancel(requesterActor, request.getId()))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_TRANSITION));
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.BORROWED);
    }

    @Test
    void unknownRequestIsNotFound() {
        UUID requestId = UUID.randomUUID();
        when(deviceRequestRepository.findDeviceIdByRequestId(requestId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> deviceRequestService.approve(adminActor, requestId))
                .isInstanceOfSatisfying(WorkflowException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo(DeviceRequestService.DEVICE_REQUEST_NOT_FOUND);
                });
    }

    @Test
    void strangerCannotReadRequestButAdminCan() {
        DeviceRequest request = request(DeviceRequestStatus.PENDING);
        when(deviceRequestRepository.findDetailedById(request.getId())).thenReturn(Optional.of(request));
        Actor stranger = new Actor(UUID.randomUUID(), EmployeeRole.HR, null, true);

        assertThatThrownBy(() -> deviceRequestService.get(stranger, request.getId()))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.FORBIDDEN));
        assertThat(deviceRequestService.get(adminActor, request.getId()).requestId()).isEqualTo(request.getId());
        assertThat(deviceRequestService.get(requesterActor, request.getId()).requestId()).isEqualTo(request.getId());
    }

    private void stubLocked(DeviceRequest request) {
        when(deviceRequestRepository.findDeviceIdByRequestId(request.getId())).thenReturn(Optional.of(device.getId()));
        when(deviceRepository.findByIdForUpdate(eq(device.getId()))).thenReturn(Optional.of(device));
        when(deviceRequestRepository.findByIdForUpdate(request.getId())).thenReturn(Optional.of(request));
    }

    private DeviceRequest request(DeviceRequestStatus status) {
        DeviceRequest request = new DeviceRequest();
        request.setDevice(device);
        request.setRequester(requester);
        request.setStatus(status);
        request.setRequestedAt(NOW.minusHours(1));
        boolean inHand = status == DeviceRequestStatus.COLLECTED || status == DeviceRequestStatus.RETURN_PENDING;
        device.setStatus(inHand ? DeviceStatus.BORROWED : DeviceStatus.UNDER_REQUEST);
        return EntityIds.assign(request, UUID.randomUUID());
    }

    private static Employee employee(String loginId, EmployeeRole role) {
        Employee employee = new Employee();
        employee.setLoginId(loginId);
        employee.setFullName(loginId);
        employee.setRole(role);
        return EntityIds.assign(employee, UUID.randomUUID());
    }
}
