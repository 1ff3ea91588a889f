package com.coopledger.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Header of a balanced set of journal lines.
 *
 * Entries are append-only. The only mutation is the reversal stamp, set once
 * when a mirror entry is posted.
 */
@Entity
@Table(name = "journal_entries", indexes = {
    @Index(name = "idx_journal_entry_source", columnList = "source_type, source_ref"),
    @Index(name = "idx_journal_entry_cycle", columnList = "cycle_id"),
    @Index(name = "idx_journal_entry_date", columnList = "entry_date")
})
@Data
@NoArgsConstructor
public class JournalEntry {

    @Id
    private String id;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(nullable = false)
    private String description;

    @Column(name = "cycle_id")
    private String cycleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false)
    private SourceType sourceType;

    /**
     * Id of the record that produced this entry, interpreted according to the source type.
     */
    @Column(name = "source_ref")
    private String sourceRef;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "reversed_by")
    private String reversedBy;

    @Column(name = "reversed_at")
    private Instant reversedAt;

    @Column(name = "reversal_reason")
    private String reversalReason;

    @Column(name = "reversal_entry_id")
    private String reversalEntryId;

    public JournalEntry(LocalDate entryDate, String description, String cycleId,
                        SourceType sourceType, String sourceRef, String createdBy) {
        this.id = UUID.randomUUID().toString();
        this.entryDate = entryDate;
        this.description = description;
        this.cycleId = cycleId;
        this.sourceType = sourceType;
        this.sourceRef = sourceRef;
        this.createdBy = createdBy;
        this.createdAt = Instant.now();
    }

    public boolean isReversed() {
        return reversedAt != null;
    }

    public void markReversed(String actorId, String reason, String reversalEntryId) {
        this.reversedBy = actorId;
        this.reversedAt = Instant.now();
        this.reversalReason = reason;
        this.reversalEntryId = reversalEntryId;
    }
}
