package com.coopledger.loans;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A loan created when its application is approved.
 *
 * APPROVED until disbursed, then OPEN until repaid in full, then CLOSED.
 */
@Entity
@Table(name = "loans", indexes =
    @Index(name = "idx_loan_member_status", columnList = "member_id, status"))
@Data
@NoArgsConstructor
public class Loan {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    @Id
    private String id;

    @Column(name = "application_id", nullable = false)
    private String applicationId;

    @Column(name = "member_id", nullable = false)
    private String memberId;

    @Column(name = "cycle_id", nullable = false)
    private String cycleId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    /**
     * Interest for the whole loan, in percent of the amount.
     */
    @Column(name = "interest_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal interestRate;

    @Column(name = "term_months", nullable = false)
    private int termMonths;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LoanStatus status;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "disbursement_date")
    private LocalDate disbursementDate;

    @Column(name = "disbursement_entry_id")
    private String disbursementEntryId;

    @Column(name = "disbursed_by")
    private String disbursedBy;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "created_at")
    private Instant createdAt;

    public Loan(LoanApplication application, BigDecimal interestRate, String approvedBy) {
        this.id = UUID.randomUUID().toString();
        this.applicationId = application.getId();
        this.memberId = application.getMemberId();
        this.cycleId = application.getCycleId();
        this.amount = application.getAmount();
        this.termMonths = application.getTermMonths();
        this.interestRate = interestRate;
        this.approvedBy = approvedBy;
        this.status = LoanStatus.APPROVED;
        this.approvedAt = Instant.now();
        this.createdAt = Instant.now();
    }

    public void disburse(LocalDate date, String journalEntryId, String actorId) {
        if (status != LoanStatus.APPROVED) {
            throw new InvalidStateException("Loan", id, status.name(), "disburse");
        }
        this.status = LoanStatus.OPEN;
        this.disbursementDate = date;
        this.disbursementEntryId = journalEntryId;
        this.disbursedBy = actorId;
    }

    public void close() {
        if (!LoanStatus.REPAYABLE.contains(status)) {
            throw new InvalidStateException("Loan", id, status.name(), "close");
        }
        this.status = LoanStatus.CLOSED;
        this.closedAt = Instant.now();
    }

    public BigDecimal expectedInterest() {
        return Amounts.normalize(amount.multiply(interestRate).divide(HUNDRED, Amounts.SCALE, RoundingMode.HALF_UP));
    }

    public boolean isRepayable() {
        return LoanStatus.REPAYABLE.contains(status);
    }
}
