package com.coopledger.loans;

import com.coopledger.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "loan_applications", indexes =
    @Index(name = "idx_loan_application_member", columnList = "member_id, status"))
@Data
@NoArgsConstructor
public class LoanApplication {

    @Id
    private String id;

    @Version
    private Long version;

    @Column(name = "member_id", nullable = false)
    private String memberId;

    @Column(name = "cycle_id", nullable = false)
    private String cycleId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "term_months", nullable = false)
    private int termMonths;

    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LoanApplicationStatus status;

    @Column(name = "decided_by")
    private String decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Column(name = "loan_id")
    private String loanId;

    @Column(name = "created_at")
    private Instant createdAt;

    public LoanApplication(String memberId, String cycleId, BigDecimal amount, int termMonths, String notes) {
        this.id = UUID.randomUUID().toString();
        this.memberId = memberId;
        this.cycleId = cycleId;
        this.amount = amount;
        this.termMonths = termMonths;
        this.notes = notes;
        this.status = LoanApplicationStatus.PENDING;
        this.createdAt = Instant.now();
    }

    public void approve(String actorId, String loanId) {
        requirePending("approve");
        this.status = LoanApplicationStatus.APPROVED;
        this.decidedBy = actorId;
        this.decidedAt = Instant.now();
        this.loanId = loanId;
    }

    public void reject(String actorId, String reason) {
        requirePending("reject");
        this.status = LoanApplicationStatus.REJECTED;
        this.decidedBy = actorId;
        this.decidedAt = Instant.now();
        this.rejectionReason = reason;
    }

    public void withdraw() {
        requirePending("withdraw");
        this.status = LoanApplicationStatus.WITHDRAWN;
        this.decidedAt = Instant.now();
    }

    private void requirePending(String operation) {
        if (status != LoanApplicationStatus.PENDING) {
            throw new InvalidStateException("Loan application", id, status.name(), operation);
        }
    }
}
