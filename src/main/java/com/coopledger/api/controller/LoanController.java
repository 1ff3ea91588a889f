package com.coopledger.api.controller;

import com.coopledger.api.dto.CommentRequest;
import com.coopledger.api.dto.LoanApplicationForm;
import com.coopledger.credit.BorrowingEligibility;
import com.coopledger.credit.CreditRatingResolver;
import com.coopledger.loans.Loan;
import com.coopledger.loans.LoanApplication;
import com.coopledger.loans.LoanPosition;
import com.coopledger.loans.LoanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for loan applications and loans.
 */
@RestController
@RequestMapping("/api/v1/loans")
@RequiredArgsConstructor
@Tag(name = "Loans", description = "Loan lifecycle API")
public class LoanController {

    private final LoanService loanService;
    private final CreditRatingResolver creditRatingResolver;

    @GetMapping("/eligibility")
    @Operation(summary = "Resolve a member's borrowing limit and rates for a cycle")
    public ResponseEntity<BorrowingEligibility> getEligibility(@RequestParam String memberId,
                                                               @RequestParam String cycleId) {
        return ResponseEntity.ok(creditRatingResolver.resolve(memberId, cycleId));
    }

    @PostMapping("/applications")
    @Operation(summary = "Apply for a loan")
    public ResponseEntity<LoanApplication> apply(@Valid @RequestBody LoanApplicationForm request) {
        LoanApplication application = loanService.apply(request.getMemberId(), request.getCycleId(),
            request.getAmount(), request.getTermMonths(), request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(application);
    }

    @GetMapping("/applications/{applicationId}")
    @Operation(summary = "Get loan application details")
    public ResponseEntity<LoanApplication> getApplication(@PathVariable String applicationId) {
        return ResponseEntity.ok(loanService.getApplication(applicationId));
    }

    @GetMapping("/cycles/{cycleId}/applications/pending")
    @Operation(summary = "List pending applications in a cycle")
    public ResponseEntity<List<LoanApplication>> getPendingApplications(@PathVariable String cycleId) {
        return ResponseEntity.ok(loanService.getPendingApplications(cycleId));
    }

    @PostMapping("/applications/{applicationId}/approve")
    @Operation(summary = "Approve an application and create the loan")
    public ResponseEntity<Loan> approve(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                        @PathVariable String applicationId) {
        return ResponseEntity.ok(loanService.approveApplication(applicationId, actorId));
    }

    @PostMapping("/applications/{applicationId}/reject")
    @Operation(summary = "Reject an application")
    public ResponseEntity<LoanApplication> reject(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                  @PathVariable String applicationId,
                                                  @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.ok(loanService.rejectApplication(applicationId, request.getComment(), actorId));
    }

    @PostMapping("/applications/{applicationId}/withdraw")
    @Operation(summary = "Withdraw one's own pending application")
    public ResponseEntity<LoanApplication> withdraw(@PathVariable String applicationId,
                                                    @RequestParam String memberId) {
        return ResponseEntity.ok(loanService.withdrawApplication(applicationId, memberId));
    }

    @GetMapping("/{loanId}")
    @Operation(summary = "Get loan details")
    public ResponseEntity<Loan> getLoan(@PathVariable String loanId) {
        return ResponseEntity.ok(loanService.getLoan(loanId));
    }

    @GetMapping("/member/{memberId}")
    @Operation(summary = "List a member's loans")
    public ResponseEntity<List<Loan>> getMemberLoans(@PathVariable String memberId) {
        return ResponseEntity.ok(loanService.getMemberLoans(memberId));
    }

    @PostMapping("/{loanId}/disburse")
    @Operation(summary = "Disburse an approved loan")
    public ResponseEntity<Loan> disburse(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                         @PathVariable String loanId) {
        return ResponseEntity.ok(loanService.disburse(loanId, actorId));
    }

    @GetMapping("/{loanId}/position")
    @Operation(summary = "Get repayment position of a loan")
    public ResponseEntity<LoanPosition> getPosition(@PathVariable String loanId) {
        return ResponseEntity.ok(loanService.loanPosition(loanId));
    }
}
