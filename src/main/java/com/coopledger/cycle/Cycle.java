package com.coopledger.cycle;

import com.coopledger.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An annual operating period of the cooperative.
 *
 * Ledger balances are not stored per cycle, so closing or reopening a cycle
 * never touches them.
 */
@Entity
@Table(name = "cycles", uniqueConstraints =
    @UniqueConstraint(name = "uk_cycle_year", columnNames = "cycle_year"))
@Data
@NoArgsConstructor
public class Cycle {

    @Id
    private String id;

    @Column(name = "cycle_year", nullable = false)
    private int year;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CycleStatus status;

    /**
     * Amount each member owes the social fund for the cycle, if the cycle defines one.
     */
    @Column(name = "social_fund_required", precision = 19, scale = 2)
    private BigDecimal socialFundRequired;

    @Column(name = "admin_fund_required", precision = 19, scale = 2)
    private BigDecimal adminFundRequired;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Cycle(int year, LocalDate startDate, LocalDate endDate,
                 BigDecimal socialFundRequired, BigDecimal adminFundRequired, String createdBy) {
        this.id = UUID.randomUUID().toString();
        this.year = year;
        this.startDate = startDate;
        this.endDate = endDate;
        this.socialFundRequired = socialFundRequired;
        this.adminFundRequired = adminFundRequired;
        this.createdBy = createdBy;
        this.status = CycleStatus.DRAFT;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public void activate() {
        if (status == CycleStatus.CLOSED) {
            throw new InvalidStateException("Cycle", id, status.name(), "activate");
        }
        this.status = CycleStatus.ACTIVE;
        this.updatedAt = Instant.now();
    }

    /**
     * Demoted when another cycle is activated.
     */
    public void demote() {
        if (status != CycleStatus.ACTIVE) {
            throw new InvalidStateException("Cycle", id, status.name(), "demote");
        }
        this.status = CycleStatus.DRAFT;
        this.updatedAt = Instant.now();
    }

    public void close() {
        this.status = CycleStatus.CLOSED;
        this.updatedAt = Instant.now();
    }

    /**
     * Only closed cycles of the current or a future year may be reopened.
     */
    public void reopen(int currentYear) {
        if (status != CycleStatus.CLOSED) {
            throw new InvalidStateException("Cycle", id, status.name(), "reopen");
        }
        if (year < currentYear) {
            throw new InvalidStateException(String.format(
                "Cycle %s for %d is in the past and cannot be reopened", id, year));
        }
        this.status = CycleStatus.DRAFT;
        this.updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == CycleStatus.ACTIVE;
    }

    public boolean isClosed() {
        return status == CycleStatus.CLOSED;
    }
}
