package com.coopledger.penalties;

import com.coopledger.common.Months;
import com.coopledger.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A penalty charged to a member.
 *
 * The fee is copied from the penalty type when the record is issued, so later fee
 * changes do not affect it.
 */
@Entity
@Table(name = "penalty_records", indexes =
    @Index(name = "idx_penalty_member_type", columnList = "member_id, penalty_type_id"))
@Data
@NoArgsConstructor
public class PenaltyRecord {

    @Id
    private String id;

    @Version
    private Long version;

    @Column(name = "member_id", nullable = false)
    private String memberId;

    @Column(name = "penalty_type_id", nullable = false)
    private String penaltyTypeId;

    @Column(name = "cycle_id")
    private String cycleId;

    @Column(name = "fee_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal feeAmount;

    @Column(name = "date_issued", nullable = false)
    private LocalDate dateIssued;

    /**
     * First day of the month the penalty relates to. Null on rows issued before the column existed.
     */
    @Column(name = "effective_month")
    private LocalDate effectiveMonth;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PenaltyRecordStatus status;

    private String notes;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    /**
     * Entry that charged the penalty to the member.
     */
    @Column(name = "journal_entry_id")
    private String journalEntryId;

    /**
     * Deposit approval entry whose declared penalties paid this record.
     */
    @Column(name = "paid_by_entry_id")
    private String paidByEntryId;

    @Column(name = "paid_at")
    private Instant paidAt;

    public PenaltyRecord(String memberId, PenaltyType type, String cycleId, LocalDate dateIssued,
                         LocalDate effectiveMonth, String notes, String createdBy) {
        this.id = UUID.randomUUID().toString();
        this.memberId = memberId;
        this.penaltyTypeId = type.getId();
        this.feeAmount = type.getFeeAmount();
        this.cycleId = cycleId;
        this.dateIssued = dateIssued;
        this.effectiveMonth = effectiveMonth;
        this.notes = notes;
        this.createdBy = createdBy;
        this.status = PenaltyRecordStatus.PENDING;
        this.createdAt = Instant.now();
    }

    public void approve(String actorId, String journalEntryId) {
        if (status != PenaltyRecordStatus.PENDING) {
            throw new InvalidStateException("Penalty record", id, status.name(), "approve");
        }
        this.status = PenaltyRecordStatus.APPROVED;
        this.approvedBy = actorId;
        this.approvedAt = Instant.now();
        this.journalEntryId = journalEntryId;
    }

    public void markPaid(String depositEntryId) {
        if (status != PenaltyRecordStatus.APPROVED) {
            throw new InvalidStateException("Penalty record", id, status.name(), "mark paid");
        }
        this.status = PenaltyRecordStatus.PAID;
        this.paidByEntryId = depositEntryId;
        this.paidAt = Instant.now();
    }

    /**
     * Whether this record was issued for the given month. Rows without an effective
     * month are matched on the month named in their notes, then on the issue date.
     */
    public boolean coversMonth(LocalDate month) {
        if (effectiveMonth != null) {
            return effectiveMonth.equals(month);
        }
        if (notes != null && notes.contains(Months.label(month))) {
            return true;
        }
        return Months.firstDay(dateIssued).equals(month);
    }

    public boolean isOutstanding() {
        return status == PenaltyRecordStatus.PENDING || status == PenaltyRecordStatus.APPROVED;
    }
}
