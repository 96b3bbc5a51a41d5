package com.example.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A fiscal period with an inclusive date range. Periods of one organization never overlap.
 * Workflow: OPEN → CLOSED → LOCKED, with a privileged reopen back to OPEN.
 * Only LOCKED is a hard barrier for postings unless closed periods are configured as enforced.
 */
@Entity
@Table(name = "fiscal_period", indexes = {
    @Index(name = "idx_fiscal_period_org_dates", columnList = "org_id, starts_at, ends_at")
})
public class FiscalPeriod {

    public enum Status {
        OPEN,
        CLOSED,
        LOCKED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @NotBlank
    @Size(max = 50)
    @Column(nullable = false, length = 50)
    private String name;

    @NotNull
    @Column(name = "starts_at", nullable = false)
    private LocalDate startsAt;

    @NotNull
    @Column(name = "ends_at", nullable = false)
    private LocalDate endsAt;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Status status = Status.OPEN;

    @Column(name = "closed_by_id")
    private Long closedById;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "locked_by_id")
    private Long lockedById;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "reopened_by_id")
    private Long reopenedById;

    @Column(name = "reopened_at")
    private Instant reopenedAt;

    @Size(max = 500)
    @Column(name = "reopen_reason", length = 500)
    private String reopenReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public FiscalPeriod() {
    }

    public FiscalPeriod(Long orgId, String name, LocalDate startsAt, LocalDate endsAt) {
        this.orgId = orgId;
        this.name = name;
        this.startsAt = startsAt;
        this.endsAt = endsAt;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startsAt) && !date.isAfter(endsAt);
    }

    public boolean isOpen() {
        return status == Status.OPEN;
    }

    public boolean isClosed() {
        return status == Status.CLOSED;
    }

    public boolean isLocked() {
        return status == Status.LOCKED;
    }

    public void close(Long userId) {
        this.status = Status.CLOSED;
        this.closedById = userId;
        this.closedAt = Instant.now();
    }

    public void lock(Long userId) {
        this.status = Status.LOCKED;
        this.lockedById = userId;
        this.lockedAt = Instant.now();
    }

    public void reopen(Long userId, String reason) {
        this.status = Status.OPEN;
        this.reopenedById = userId;
        this.reopenedAt = Instant.now();
        this.reopenReason = reason;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getOrgId() {
        return orgId;
    }

    public void setOrgId(Long orgId) {
        this.orgId = orgId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public LocalDate getStartsAt() {
        return startsAt;
    }

    public void setStartsAt(LocalDate startsAt) {
        this.startsAt = startsAt;
    }

    public LocalDate getEndsAt() {
        return endsAt;
    }

    public void setEndsAt(LocalDate endsAt) {
        this.endsAt = endsAt;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public Long getClosedById() {
        return closedById;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public Long getLockedById() {
        return lockedById;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public Long getReopenedById() {
        return reopenedById;
    }

    public Instant getReopenedAt() {
        return reopenedAt;
    }

    public String getReopenReason() {
        return reopenReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
