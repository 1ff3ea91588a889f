package com.coopledger.api.controller;

import com.coopledger.api.dto.CommentRequest;
import com.coopledger.api.dto.DeclarationRequest;
import com.coopledger.api.dto.SubmitProofRequest;
import com.coopledger.common.exception.ValidationException;
import com.coopledger.declarations.Declaration;
import com.coopledger.declarations.DeclarationService;
import com.coopledger.declarations.DepositApproval;
import com.coopledger.declarations.DepositProof;
import com.coopledger.deposits.DepositApprovalPoster;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for declarations, proofs of deposit and their approval.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Declarations", description = "Declaration and deposit proof API")
public class DeclarationController {

    private final DeclarationService declarationService;
    private final DepositApprovalPoster depositApprovalPoster;

    @PostMapping("/declarations")
    @Operation(summary = "Declare a member's payments for a month")
    public ResponseEntity<Declaration> createDeclaration(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                         @Valid @RequestBody DeclarationRequest request) {
        if (request.getMemberId() == null || request.getCycleId() == null || request.getEffectiveMonth() == null) {
            throw new ValidationException("Member, cycle and effective month are required");
        }
        Declaration declaration = declarationService.createDeclaration(request.getMemberId(),
            request.getCycleId(), request.getEffectiveMonth(), request.toAmounts(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(declaration);
    }

    @GetMapping("/declarations/{declarationId}")
    @Operation(summary = "Get declaration details")
    public ResponseEntity<Declaration> getDeclaration(@PathVariable String declarationId) {
        return ResponseEntity.ok(declarationService.getDeclaration(declarationId));
    }

    @GetMapping("/members/{memberId}/cycles/{cycleId}/declarations")
    @Operation(summary = "List a member's declarations in a cycle")
    public ResponseEntity<List<Declaration>> getMemberDeclarations(@PathVariable String memberId,
                                                                   @PathVariable String cycleId) {
        return ResponseEntity.ok(declarationService.getMemberDeclarations(memberId, cycleId));
    }

    @PutMapping("/declarations/{declarationId}")
    @Operation(summary = "Edit a pending declaration")
    public ResponseEntity<Declaration> updateDeclaration(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                         @PathVariable String declarationId,
                                                         @Valid @RequestBody DeclarationRequest request) {
        return ResponseEntity.ok(declarationService.updateDeclaration(declarationId, request.toAmounts(), actorId));
    }

    @PostMapping("/declarations/{declarationId}/reject")
    @Operation(summary = "Void a pending declaration")
    public ResponseEntity<Declaration> rejectDeclaration(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                         @PathVariable String declarationId,
                                                         @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.ok(declarationService.rejectDeclaration(declarationId, actorId, request.getComment()));
    }

    @PostMapping("/declarations/{declarationId}/proof")
    @Operation(summary = "Submit or resubmit proof of deposit")
    public ResponseEntity<DepositProof> submitProof(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                    @PathVariable String declarationId,
                                                    @Valid @RequestBody SubmitProofRequest request) {
        DepositProof proof = declarationService.submitProof(declarationId, request.getAmount(),
            request.getReference(), request.getUploadPath(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(proof);
    }

    @GetMapping("/cycles/{cycleId}/proofs/pending")
    @Operation(summary = "List proofs awaiting review")
    public ResponseEntity<List<DepositProof>> getProofsAwaitingReview(@PathVariable String cycleId) {
        return ResponseEntity.ok(declarationService.getProofsAwaitingReview(cycleId));
    }

    @PostMapping("/proofs/{proofId}/approve")
    @Operation(summary = "Approve a proof and post it to the ledger")
    public ResponseEntity<DepositApproval> approveProof(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                       @PathVariable String proofId,
                                                       @RequestParam(required = false) String notes) {
        return ResponseEntity.ok(depositApprovalPoster.approveDeposit(proofId, actorId, notes));
    }

    @PostMapping("/proofs/{proofId}/reject")
    @Operation(summary = "Reject a proof with a comment")
    public ResponseEntity<DepositProof> rejectProof(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                    @PathVariable String proofId,
                                                    @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.ok(declarationService.rejectProof(proofId, request.getComment(), actorId));
    }

    @PostMapping("/proofs/{proofId}/response")
    @Operation(summary = "Respond to a proof rejection")
    public ResponseEntity<DepositProof> respond(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                @PathVariable String proofId,
                                                @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.ok(declarationService.respondToRejection(proofId, request.getComment(), actorId));
    }
}
