package com.coopledger.credit;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What a member may borrow in a cycle and at which rates.
 */
@Value
@Builder
public class BorrowingEligibility {
    String memberId;
    String cycleId;
    CreditRatingTier tier;
    BigDecimal multiplier;
    BigDecimal savingsBalance;
    BigDecimal maxLoanAmount;
    InterestRateSchedule rates;
}
