package com.coopledger.declarations;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Links an approved proof to the journal entry that posted it.
 */
@Entity
@Table(name = "deposit_approvals", uniqueConstraints = {
    @UniqueConstraint(name = "uk_deposit_approval_proof", columnNames = "deposit_proof_id"),
    @UniqueConstraint(name = "uk_deposit_approval_entry", columnNames = "journal_entry_id")
})
@Data
@NoArgsConstructor
public class DepositApproval {

    @Id
    private String id;

    @Column(name = "deposit_proof_id", nullable = false)
    private String depositProofId;

    @Column(name = "journal_entry_id", nullable = false)
    private String journalEntryId;

    @Column(name = "approved_by", nullable = false)
    private String approvedBy;

    @Column(name = "approved_at", nullable = false)
    private Instant approvedAt;

    private String notes;

    public DepositApproval(String depositProofId, String journalEntryId, String approvedBy, String notes) {
        this.id = UUID.randomUUID().toString();
        this.depositProofId = depositProofId;
        this.journalEntryId = journalEntryId;
        this.approvedBy = approvedBy;
        this.notes = notes;
        this.approvedAt = Instant.now();
    }
}
