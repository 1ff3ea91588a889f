package com.coopledger.declarations;

import com.coopledger.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Evidence that a declared payment was made. One proof per declaration; a rejected
 * proof is resubmitted in place and keeps its comment trail.
 */
@Entity
@Table(name = "deposit_proofs", uniqueConstraints =
    @UniqueConstraint(name = "uk_deposit_proof_declaration", columnNames = "declaration_id"))
@Data
@NoArgsConstructor
public class DepositProof {

    @Id
    private String id;

    @Version
    private Long version;

    @Column(name = "declaration_id", nullable = false)
    private String declarationId;

    @Column(name = "member_id", nullable = false)
    private String memberId;

    @Column(name = "cycle_id", nullable = false)
    private String cycleId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    /**
     * Bank or transfer reference quoted by the member.
     */
    private String reference;

    @Column(name = "upload_path")
    private String uploadPath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DepositProofStatus status;

    @Column(name = "treasurer_comment", length = 2000)
    private String treasurerComment;

    @Column(name = "member_response", length = 2000)
    private String memberResponse;

    @Column(name = "rejected_by")
    private String rejectedBy;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "submission_count", nullable = false)
    private int submissionCount;

    public DepositProof(Declaration declaration, BigDecimal amount, String reference, String uploadPath) {
        this.id = UUID.randomUUID().toString();
        this.declarationId = declaration.getId();
        this.memberId = declaration.getMemberId();
        this.cycleId = declaration.getCycleId();
        this.amount = amount;
        this.reference = reference;
        this.uploadPath = uploadPath;
        this.status = DepositProofStatus.SUBMITTED;
        this.submittedAt = Instant.now();
        this.submissionCount = 1;
    }

    public void resubmit(BigDecimal amount, String reference, String uploadPath) {
        if (status != DepositProofStatus.REJECTED) {
            throw new InvalidStateException("Deposit proof", id, status.name(), "resubmit");
        }
        this.amount = amount;
        this.reference = reference;
        if (uploadPath != null) {
            this.uploadPath = uploadPath;
        }
        this.status = DepositProofStatus.SUBMITTED;
        this.submittedAt = Instant.now();
        this.submissionCount++;
    }

    /**
     * Rejecting an already rejected proof replaces the comment.
     */
    public void reject(String comment, String actorId) {
        if (status == DepositProofStatus.APPROVED) {
            throw new InvalidStateException("Deposit proof", id, status.name(), "reject");
        }
        this.status = DepositProofStatus.REJECTED;
        this.treasurerComment = comment;
        this.rejectedBy = actorId;
        this.rejectedAt = Instant.now();
    }

    public void respond(String response) {
        if (status != DepositProofStatus.REJECTED) {
            throw new InvalidStateException("Deposit proof", id, status.name(), "respond");
        }
        this.memberResponse = response;
    }

    /**
     * A rejected proof may be approved directly once the treasurer accepts the member's response.
     */
    public void approve(String actorId) {
        if (status == DepositProofStatus.APPROVED) {
            throw new InvalidStateException("Deposit proof", id, status.name(), "approve");
        }
        this.status = DepositProofStatus.APPROVED;
        this.approvedBy = actorId;
        this.approvedAt = Instant.now();
    }
}
