package com.coopledger.penalties;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "penalty_types", uniqueConstraints =
    @UniqueConstraint(name = "uk_penalty_type_name", columnNames = "name"))
@Data
@NoArgsConstructor
public class PenaltyType {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(name = "fee_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal feeAmount;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "created_at")
    private Instant createdAt;

    public PenaltyType(String name, String description, BigDecimal feeAmount) {
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.description = description;
        this.feeAmount = feeAmount;
        this.enabled = true;
        this.createdAt = Instant.now();
    }
}
