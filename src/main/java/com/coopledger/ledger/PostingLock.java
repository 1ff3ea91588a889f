package com.coopledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * While present, deposit approvals and loan disbursements for the cycle are refused.
 */
@Entity
@Table(name = "posting_locks", uniqueConstraints =
    @UniqueConstraint(name = "uk_posting_lock_cycle", columnNames = "cycle_id"))
@Data
@NoArgsConstructor
public class PostingLock {

    @Id
    private String id;

    @Column(name = "cycle_id", nullable = false)
    private String cycleId;

    @Column(name = "locked_by", nullable = false)
    private String lockedBy;

    @Column(name = "locked_at", nullable = false)
    private Instant lockedAt;

    private String reason;

    public PostingLock(String cycleId, String lockedBy, String reason) {
        this.id = UUID.randomUUID().toString();
        this.cycleId = cycleId;
        this.lockedBy = lockedBy;
        this.reason = reason;
        this.lockedAt = Instant.now();
    }
}
