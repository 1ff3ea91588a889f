package com.coopledger.credit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(name = "credit_rating_tiers")
@Data
@NoArgsConstructor
public class CreditRatingTier {

    @Id
    private String id;

    @Column(name = "scheme_id", nullable = false)
    private String schemeId;

    @Column(nullable = false)
    private String name;

    /**
     * Position of the tier within its scheme, lowest first.
     */
    @Column(name = "tier_order", nullable = false)
    private int tierOrder;

    private String description;

    public CreditRatingTier(String schemeId, String name, int tierOrder, String description) {
        this.id = UUID.randomUUID().toString();
        this.schemeId = schemeId;
        this.name = name;
        this.tierOrder = tierOrder;
        this.description = description;
    }
}
