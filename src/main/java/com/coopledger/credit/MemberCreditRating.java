package com.coopledger.credit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * The tier a member is placed in for one cycle.
 */
@Entity
@Table(name = "member_credit_ratings", uniqueConstraints =
    @UniqueConstraint(name = "uk_member_credit_rating", columnNames = {"member_id", "cycle_id"}))
@Data
@NoArgsConstructor
public class MemberCreditRating {

    @Id
    private String id;

    @Column(name = "member_id", nullable = false)
    private String memberId;

    @Column(name = "cycle_id", nullable = false)
    private String cycleId;

    @Column(name = "tier_id", nullable = false)
    private String tierId;

    @Column(name = "assigned_by")
    private String assignedBy;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    private String notes;

    public MemberCreditRating(String memberId, String cycleId) {
        this.id = UUID.randomUUID().toString();
        this.memberId = memberId;
        this.cycleId = cycleId;
    }

    public void assign(String tierId, String assignedBy, String notes) {
        this.tierId = tierId;
        this.assignedBy = assignedBy;
        this.notes = notes;
        this.assignedAt = Instant.now();
    }
}
