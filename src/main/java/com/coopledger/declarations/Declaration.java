package com.coopledger.declarations;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A member's stated payments for one month of a cycle.
 *
 * PENDING moves to PROOF when a proof is uploaded and to APPROVED when the proof
 * is posted. A rejected proof sends it back to PENDING and leaves it editable.
 */
@Entity
@Table(name = "declarations", uniqueConstraints =
    @UniqueConstraint(name = "uk_declaration_member_month", columnNames = {"member_id", "cycle_id", "effective_month"}))
@Data
@NoArgsConstructor
public class Declaration {

    @Id
    private String id;

    @Column(name = "member_id", nullable = false)
    private String memberId;

    @Column(name = "cycle_id", nullable = false)
    private String cycleId;

    @Column(name = "effective_month", nullable = false)
    private LocalDate effectiveMonth;

    @Column(name = "savings_amount", precision = 19, scale = 2)
    private BigDecimal savingsAmount;

    @Column(name = "social_fund_amount", precision = 19, scale = 2)
    private BigDecimal socialFundAmount;

    @Column(name = "admin_fund_amount", precision = 19, scale = 2)
    private BigDecimal adminFundAmount;

    @Column(name = "penalties_amount", precision = 19, scale = 2)
    private BigDecimal penaltiesAmount;

    @Column(name = "interest_on_loan_amount", precision = 19, scale = 2)
    private BigDecimal interestOnLoanAmount;

    @Column(name = "loan_repayment_amount", precision = 19, scale = 2)
    private BigDecimal loanRepaymentAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeclarationStatus status;

    /**
     * Set when a proof for this declaration was rejected; the member may then edit outside the usual window.
     */
    @Column(name = "reopened_by_rejection", nullable = false)
    private boolean reopenedByRejection;

    @Column(name = "rejected_by")
    private String rejectedBy;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Declaration(String memberId, String cycleId, LocalDate effectiveMonth, DeclaredAmounts amounts) {
        this.id = UUID.randomUUID().toString();
        this.memberId = memberId;
        this.cycleId = cycleId;
        this.effectiveMonth = effectiveMonth;
        this.status = DeclarationStatus.PENDING;
        this.createdAt = Instant.now();
        applyAmounts(amounts);
    }

    public void updateAmounts(DeclaredAmounts amounts) {
        if (status != DeclarationStatus.PENDING) {
            throw new InvalidStateException("Declaration", id, status.name(), "edit");
        }
        applyAmounts(amounts);
    }

    public void proofSubmitted() {
        if (status != DeclarationStatus.PENDING) {
            throw new InvalidStateException("Declaration", id, status.name(), "submit proof");
        }
        this.status = DeclarationStatus.PROOF;
        this.updatedAt = Instant.now();
    }

    public void proofRejected() {
        if (status == DeclarationStatus.APPROVED || status == DeclarationStatus.REJECTED) {
            throw new InvalidStateException("Declaration", id, status.name(), "reject proof");
        }
        this.status = DeclarationStatus.PENDING;
        this.reopenedByRejection = true;
        this.updatedAt = Instant.now();
    }

    public void approve() {
        if (status != DeclarationStatus.PROOF && !(status == DeclarationStatus.PENDING && reopenedByRejection)) {
            throw new InvalidStateException("Declaration", id, status.name(), "approve");
        }
        this.status = DeclarationStatus.APPROVED;
        this.updatedAt = Instant.now();
    }

    public void reject(String actorId, String reason) {
        if (status != DeclarationStatus.PENDING) {
            throw new InvalidStateException("Declaration", id, status.name(), "reject");
        }
        this.status = DeclarationStatus.REJECTED;
        this.rejectedBy = actorId;
        this.rejectionReason = reason;
        this.updatedAt = Instant.now();
    }

    public DeclaredAmounts amounts() {
        return DeclaredAmounts.builder()
            .savings(savingsAmount)
            .socialFund(socialFundAmount)
            .adminFund(adminFundAmount)
            .penalties(penaltiesAmount)
            .interestOnLoan(interestOnLoanAmount)
            .loanRepayment(loanRepaymentAmount)
            .build();
    }

    public BigDecimal total() {
        return amounts().total();
    }

    public boolean hasLoanComponents() {
        return Amounts.isPositive(interestOnLoanAmount) || Amounts.isPositive(loanRepaymentAmount);
    }

    private void applyAmounts(DeclaredAmounts amounts) {
        DeclaredAmounts valid = amounts.validated();
        this.savingsAmount = valid.getSavings();
        this.socialFundAmount = valid.getSocialFund();
        this.adminFundAmount = valid.getAdminFund();
        this.penaltiesAmount = valid.getPenalties();
        this.interestOnLoanAmount = valid.getInterestOnLoan();
        this.loanRepaymentAmount = valid.getLoanRepayment();
        this.updatedAt = Instant.now();
    }
}
