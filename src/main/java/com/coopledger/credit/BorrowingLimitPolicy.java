package com.coopledger.credit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * How many times their savings a member of a tier may borrow, from a given date.
 * At most one policy per tier takes effect on any date.
 */
@Entity
@Table(name = "borrowing_limit_policies", uniqueConstraints =
    @UniqueConstraint(name = "uk_policy_tier_effective", columnNames = {"tier_id", "effective_from"}))
@Data
@NoArgsConstructor
public class BorrowingLimitPolicy {

    @Id
    private String id;

    @Column(name = "tier_id", nullable = false)
    private String tierId;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal multiplier;

    /**
     * Optional absolute ceiling applied after the multiplier.
     */
    @Column(name = "max_amount", precision = 19, scale = 2)
    private BigDecimal maxAmount;

    @Column(name = "effective_from", nullable = false)
    private LocalDate effectiveFrom;

    public BorrowingLimitPolicy(String tierId, BigDecimal multiplier, BigDecimal maxAmount, LocalDate effectiveFrom) {
        this.id = UUID.randomUUID().toString();
        this.tierId = tierId;
        this.multiplier = multiplier;
        this.maxAmount = maxAmount;
        this.effectiveFrom = effectiveFrom;
    }
}
