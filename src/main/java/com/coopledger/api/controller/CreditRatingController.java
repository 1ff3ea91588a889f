package com.coopledger.api.controller;

import com.coopledger.api.dto.AddTierRequest;
import com.coopledger.api.dto.BorrowingLimitRequest;
import com.coopledger.api.dto.CreateSchemeRequest;
import com.coopledger.api.dto.InterestRateRequest;
import com.coopledger.credit.BorrowingLimitPolicy;
import com.coopledger.credit.CreditRatingInterestRange;
import com.coopledger.credit.CreditRatingScheme;
import com.coopledger.credit.CreditRatingService;
import com.coopledger.credit.CreditRatingTier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/credit-ratings")
@RequiredArgsConstructor
@Tag(name = "Credit Ratings", description = "Tier, borrowing limit and interest rate configuration")
public class CreditRatingController {

    private final CreditRatingService creditRatingService;

    @PostMapping("/schemes")
    @Operation(summary = "Create a credit rating scheme")
    public ResponseEntity<CreditRatingScheme> createScheme(@Valid @RequestBody CreateSchemeRequest request) {
        CreditRatingScheme scheme = creditRatingService.createScheme(request.getName(), request.getDescription(),
            request.getEffectiveFrom());
        return ResponseEntity.status(HttpStatus.CREATED).body(scheme);
    }

    @PostMapping("/schemes/{schemeId}/tiers")
    @Operation(summary = "Add a tier to a scheme")
    public ResponseEntity<CreditRatingTier> addTier(@PathVariable String schemeId,
                                                    @Valid @RequestBody AddTierRequest request) {
        CreditRatingTier tier = creditRatingService.addTier(schemeId, request.getName(), request.getTierOrder(),
            request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(tier);
    }

    @GetMapping("/schemes/{schemeId}/tiers")
    @Operation(summary = "List the tiers of a scheme")
    public ResponseEntity<List<CreditRatingTier>> getTiers(@PathVariable String schemeId) {
        return ResponseEntity.ok(creditRatingService.getTiers(schemeId));
    }

    @PostMapping("/tiers/{tierId}/borrowing-limits")
    @Operation(summary = "Set the borrowing multiplier of a tier")
    public ResponseEntity<BorrowingLimitPolicy> setBorrowingLimit(@PathVariable String tierId,
                                                                  @Valid @RequestBody BorrowingLimitRequest request) {
        BorrowingLimitPolicy policy = creditRatingService.setBorrowingLimit(tierId, request.getMultiplier(),
            request.getMaxAmount(), request.getEffectiveFrom());
        return ResponseEntity.ok(policy);
    }

    @PutMapping("/tiers/{tierId}/interest-rates")
    @Operation(summary = "Set a tier's interest rate for a term in a cycle")
    public ResponseEntity<CreditRatingInterestRange> setInterestRate(@PathVariable String tierId,
                                                                     @Valid @RequestBody InterestRateRequest request) {
        CreditRatingInterestRange range = creditRatingService.setInterestRate(tierId, request.getCycleId(),
            request.getTermMonths(), request.getInterestRate());
        return ResponseEntity.ok(range);
    }
}
