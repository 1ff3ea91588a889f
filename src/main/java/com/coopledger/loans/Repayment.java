package com.coopledger.loans;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Principal and interest paid towards a loan through an approved declaration.
 * Counted only while the deposit entry it came from is not reversed.
 */
@Entity
@Table(name = "repayments", indexes =
    @Index(name = "idx_repayment_loan", columnList = "loan_id"))
@Data
@NoArgsConstructor
public class Repayment {

    @Id
    private String id;

    @Column(name = "loan_id", nullable = false)
    private String loanId;

    @Column(name = "member_id", nullable = false)
    private String memberId;

    @Column(name = "declaration_id")
    private String declarationId;

    @Column(name = "journal_entry_id", nullable = false)
    private String journalEntryId;

    @Column(name = "principal_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal principalAmount;

    @Column(name = "interest_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal interestAmount;

    @Column(name = "repayment_date", nullable = false)
    private LocalDate repaymentDate;

    @Column(name = "created_at")
    private Instant createdAt;

    public Repayment(Loan loan, String declarationId, String journalEntryId,
                     BigDecimal principalAmount, BigDecimal interestAmount, LocalDate repaymentDate) {
        this.id = UUID.randomUUID().toString();
        this.loanId = loan.getId();
        this.memberId = loan.getMemberId();
        this.declarationId = declarationId;
        this.journalEntryId = journalEntryId;
        this.principalAmount = principalAmount;
        this.interestAmount = interestAmount;
        this.repaymentDate = repaymentDate;
        this.createdAt = Instant.now();
    }
}
