package com.coopledger.credit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * A named set of tiers, effective from a date.
 */
@Entity
@Table(name = "credit_rating_schemes")
@Data
@NoArgsConstructor
public class CreditRatingScheme {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(name = "effective_from", nullable = false)
    private LocalDate effectiveFrom;

    @Column(nullable = false)
    private boolean active;

    public CreditRatingScheme(String name, String description, LocalDate effectiveFrom) {
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.description = description;
        this.effectiveFrom = effectiveFrom;
        this.active = true;
    }
}
