package com.coopledger.credit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Interest rate, in percent, for a tier in a cycle. A null term applies to every term.
 */
@Entity
@Table(name = "credit_rating_interest_ranges")
@Data
@NoArgsConstructor
public class CreditRatingInterestRange {

    @Id
    private String id;

    @Column(name = "tier_id", nullable = false)
    private String tierId;

    @Column(name = "cycle_id", nullable = false)
    private String cycleId;

    @Column(name = "term_months")
    private Integer termMonths;

    @Column(name = "interest_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal interestRate;

    public CreditRatingInterestRange(String tierId, String cycleId, Integer termMonths, BigDecimal interestRate) {
        this.id = UUID.randomUUID().toString();
        this.tierId = tierId;
        this.cycleId = cycleId;
        this.termMonths = termMonths;
        this.interestRate = interestRate;
    }
}
