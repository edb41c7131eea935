package com.officehub.backend.modules.device.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.officehub.backend.global.jpa.AbstractTimestampedEntity;
import com.officehub.backend.modules.employee.domain.Employee;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One borrow request for one device. Rows are never deleted; terminal requests stay
 * as history.
 */
@Entity
@Table(name = "device_request")
public class DeviceRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "requester_id", nullable = false)
    private Employee requester;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "device_id", nullable = false)
    private Device device;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DeviceRequestStatus status = DeviceRequestStatus.PENDING;

    @Column(name = "requested_at", nullable = false)
    private OffsetDateTime requestedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "decided_by")
    private Employee decidedBy;

    @Column(name = "decided_at")
    private OffsetDateTime decidedAt;

    @Column(name = "reject_reason", length = 500)
    private String rejectReason;

    @Column(name = "collected_at")
    private OffsetDateTime collectedAt;

    @Column(name = "return_requested_at")
    private OffsetDateTime returnRequestedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "return_confirmed_by")
    private Employee returnConfirmedBy;

    @Column(name = "returned_at")
    private OffsetDateTime returnedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    public UUID getId() {
        return id;
    }

    public Employee getRequester() {
        return requester;
    }

    public void setRequester(Employee requester) {
        this.requester = requester;
    }

    public Device getDevice() {
        return device;
    }

    public void setDevice(Device device) {
        this.device = device;
    }

    public DeviceRequestStatus getStatus() {
        return status;
    }

    public void setStatus(DeviceRequestStatus status) {
        this.status = status;
    }

    public OffsetDateTime getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(OffsetDateTime requestedAt) {
        this.requestedAt = requestedAt;
    }

    public Employee getDecidedBy() {
        return decidedBy;
    }

    public void setDecidedBy(Employee decidedBy) {
        this.decidedBy = decidedBy;
    }

    public OffsetDateTime getDecidedAt() {
        return decidedAt;
    }

    public void setDecidedAt(OffsetDateTime decidedAt) {
        this.decidedAt = decidedAt;
    }

    public String getRejectReason() {
        return rejectReason;
    }

    public void setRejectReason(String rejectReason) {
        this.rejectReason = rejectReason;
    }

    public OffsetDateTime getCollectedAt() {
        return collectedAt;
    }

    public void setCollectedAt(OffsetDateTime collectedAt) {
        this.collectedAt = collectedAt;
    }

    public OffsetDateTime getReturnRequestedAt() {
        return returnRequestedAt;
    }

    public void setReturnRequestedAt(OffsetDateTime returnRequestedAt) {
        this.returnRequestedAt = returnRequestedAt;
    }

    public Employee getReturnConfirmedBy() {
        return returnConfirmedBy;
    }

    public void setReturnConfirmedBy(Employee returnConfirmedBy) {
        this.returnConfirmedBy = returnConfirmedBy;
    }

    public OffsetDateTime getReturnedAt() {
        return returnedAt;
    }

    public void setReturnedAt(OffsetDateTime returnedAt) {
        this.returnedAt = returnedAt;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(OffsetDateTime cancelledAt) {
        this.cancelledAt = cancelledAt;
    }
}
