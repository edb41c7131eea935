package com.officehub.backend.modules.leave.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.officehub.backend.global.error.ErrorKind;
import com.officehub.backend.global.error.WorkflowException;
import com.officehub.backend.modules.approval.application.ApprovalGate;
import com.officehub.backend.modules.audit.application.AuditLogService;
import com.officehub.backend.modules.employee.domain.Actor;
import com.officehub.backend.modules.employee.domain.Employee;
import com.officehub.backend.modules.employee.domain.EmployeeRole;
import com.officehub.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.officehub.backend.modules.leave.domain.LeaveRequest;
import com.officehub.backend.modules.leave.domain.LeaveStatus;
import com.officehub.backend.modules.leave.domain.LeaveType;
import com.officehub.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.officehub.backend.modules.leave.presentation.dto.CreateLeaveRequest;
import com.officehub.backend.modules.leave.presentation.dto.LeaveResponse;
import com.officehub.backend.support.EntityIds;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LeaveServiceTest {

    @Mock
    private LeaveRequestRepository leaveRequestRepository;

    @Mock
    private EmployeeRepository employeeRepository;

    @Mock
    private AuditLogService auditLogService;

    private LeaveService leaveService;

    private Employee supervisor;
    private Employee subordinate;
    private Actor supervisorActor;
    private Actor subordinateActor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2024-03-01T08:00:00Z").toInstant(), ZoneOffset.UTC);
        leaveService = new LeaveService(leaveRequestRepository, employeeRepository, new ApprovalGate(),
                auditLogService, clock);

        supervisor = employee("sam", EmployeeRole.SUPERVISOR, null);
        subordinate = employee("erin", EmployeeRole.EMPLOYEE, supervisor);
        supervisorActor = new Actor(supervisor.getId(), EmployeeRole.SUPERVISOR, null, true);
        subordinateActor = new Actor(subordinate.getId(), EmployeeRole.EMPLOYEE, supervisor.getId(), true);
    }

    @Test
    void createStoresPendingRequest() {
        when(employeeRepository.getReferenceById(subordinate.getId())).thenReturn(subordinate);
        when(leaveRequestRepository.save(any(LeaveRequest.class)))
                .thenAnswer(invocation -> EntityIds.assign(invocation.getArgument(0), UUID.randomUUID()));

        LeaveResponse response = leaveService.create(subordinateActor, new CreateLeaveRequest(
                LeaveType.ANNUAL, LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 4), "family trip"));

        assertThat(response.status()).isEqualTo("PENDING");
        assertThat(response.leaveType()).isEqualTo("ANNUAL");
    }

    @Test
    @DisplayName("종료일이 시작일보다 빠르면 INVALID_INTERVAL")
    void endBeforeStartIsInvalid() {
        assertThatThrownBy(() -> leaveService.create(subordinateActor, new CreateLeaveRequest(
                LeaveType.SICK, LocalDate.of(2024, 3, 5), LocalDate.of(2024, 3, 4), null)))
                .isInstanceOfSatisfying(WorkflowException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_INTERVAL);
                    assertThat(ex.getCode()).isEqualTo(LeaveService.INVALID_LEAVE_RANGE);
                });
        verifyNoInteractions(leaveRequestRepository);
    }

    @Test
    void directSupervisorApproves() {
        LeaveRequest leave = pendingLeaveOf(subordinate);
        when(leaveRequestRepository.findByIdForUpdate(leave.getId())).thenReturn(Optional.of(leave));
        when(employeeRepository.getReferenceById(supervisor.getId())).thenReturn(supervisor);

        LeaveResponse response = leaveService.approve(supervisorActor, leave.getId());

        assertThat(response.status()).isEqualTo("APPROVED");
        assertThat(response.decidedBy()).isEqualTo(supervisor.getId());
    }

    @Test
    void supervisorOfAnotherTeamIsRejected() {
        LeaveRequest leave = pendingLeaveOf(subordinate);
        when(leaveRequestRepository.findByIdForUpdate(leave.getId())).thenReturn(Optional.of(leave));
        Actor otherSupervisor = new Actor(UUID.randomUUID(), EmployeeRole.SUPERVISOR, null, true);

        assertThatThrownBy(() -> leaveService.approve(otherSupervisor, leave.getId()))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ApprovalGate.NOT_SUPERVISOR));
        assertThat(leave.getStatus()).isEqualTo(LeaveStatus.PENDING);
    }

    @Test
    @DisplayName("본인의 휴가는 결재할 수 없다")
    void supervisorCannotApproveOwnLeave() {
        Employee director = employee("dana", EmployeeRole.SUPERVISOR, null);
        supervisor.setSupervisor(director);
        LeaveRequest ownLeave = pendingLeaveOf(supervisor);
        when(leaveRequestRepository.findByIdForUpdate(ownLeave.getId())).thenReturn(Optional.of(ownLeave));

        assertThatThrownBy(() -> leaveService.approve(supervisorActor, ownLeave.getId()))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ApprovalGate.SELF_DECISION_FORBIDDEN));
    }

    @Test
    void employeeCannotDecide() {
        assertThatThrownBy(() -> leaveService.reject(subordinateActor, UUID.randomUUID(), "no"))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ApprovalGate.ROLE_NOT_PERMITTED));
        verifyNoInteractions(leaveRequestRepository);
    }

    @Test
    void decidedLeaveCannotBeRejectedAgain() {
        LeaveRequest leave = pendingLeaveOf(subordinate);
        leave.setStatus(LeaveStatus.APPROVED);
        when(leaveRequestRepository.findByIdForUpdate(leave.getId())).thenReturn(Optional.of(leave));

        assertThatThrownBy(() -> leaveService.reject(supervisorActor, leave.getId(), "changed my mind"))
                .isInstanceOfSatisfying(WorkflowException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_TRANSITION);
                    assertThat(ex.getCode()).isEqualTo(LeaveService.LEAVE_INVALID_STATUS);
                });
        assertThat(leave.getStatus()).isEqualTo(LeaveStatus.APPROVED);
    }

    @Test
    void requesterAndSupervisorMayCancelPendingLeave() {
        LeaveRequest mine = pendingLeaveOf(subordinate);
        LeaveRequest teams = pendingLeaveOf(subordinate);
        when(leaveRequestRepository.findByIdForUpdate(mine.getId())).thenReturn(Optional.of(mine));
        when(leaveRequestRepository.findByIdForUpdate(teams.getId())).thenReturn(Optional.of(teams));

        assertThat(leaveService.cancel(subordinateActor, mine.getId()).status()).isEqualTo("CANCELLED");
        assertThat(leaveService.cancel(supervisorActor, teams.getId()).status()).isEqualTo("CANCELLED");
    }

    @Test
    void colleagueCannotCancel() {
        LeaveRequest leave = pendingLeaveOf(subordinate);
        when(leaveRequestRepository.findByIdForUpdate(leave.getId())).thenReturn(Optional.of(leave));
        Actor colleague = new Actor(UUID.randomUUID(), EmployeeRole.EMPLOYEE, supervisor.getId(), true);

        assertThatThrownBy(() -> leaveService.cancel(colleague, leave.getId()))
                .isInstanceOfSatisfying(WorkflowException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.FORBIDDEN));
        assertThat(leave.getStatus()).isEqualTo(LeaveStatus.PENDING);
    }

    @Test
    void pendingListIsScopedToDirectReports() {
        LeaveRequest leave = pendingLeaveOf(subordinate);
        when(employeeRepository.findSubordinateIds(supervisor.getId())).thenReturn(List.of(subordinate.getId()));
        when(leaveRequestRepository.findByStatusAndRequesterIdIn(LeaveStatus.PENDING, List.of(subordinate.getId())))
                .thenReturn(List.of(leave));

        List<LeaveResponse> pending = leaveService.listPendingForSupervisor(supervisorActor);

        assertThat(pending).extracting(LeaveResponse::leaveId).containsExactly(leave.getId());
    }

    @Test
    void supervisorWithoutReportsSeesNothing() {
        Actor lonely = new Actor(UUID.randomUUID(), EmployeeRole.SUPERVISOR, null, true);
        when(employeeRepository.findSubordinateIds(lonely.id())).thenReturn(List.of());

        assertThat(leaveService.listPendingForSupervisor(lonely)).isEmpty();
        verifyNoInteractions(leaveRequestRepository);
    }

    @Test
    void superAdminSeesAllPending() {
        Actor superAdmin = new Actor(UUID.randomUUID(), EmployeeRole.SUPER_ADMIN, null, true);
        when(leaveRequestRepository.findAllByStatus(LeaveStatus.PENDING)).thenReturn(List.of());

        leaveService.listPendingForSupervisor(superAdmin);

        verify(leaveRequestRepository).findAllByStatus(LeaveStatus.PENDING);
    }

    private LeaveRequest pendingLeaveOf(Employee requester) {
        LeaveRequest leave = new LeaveRequest();
        leave.setRequester(requester);
        leave.setLeaveType(LeaveType.PERSONAL);
        leave.setStartDate(LocalDate.of(2024, 3, 11));
        leave.setEndDate(LocalDate.of(2024, 3, 12));
        leave.setStatus(LeaveStatus.PENDING);
        return EntityIds.assign(leave, UUID.randomUUID());
    }

    private static Employee employee(String loginId, EmployeeRole role, Employee supervisor) {
        Employee employee = new Employee();
        employee.setLoginId(loginId);
        employee.setFullName(loginId);
        employee.setRole(role);
        employee.setSupervisor(supervisor);
        return EntityIds.assign(employee, UUID.randomUUID());
    }
}
