package com.coopledger.rules;

import com.coopledger.credit.BorrowingEligibility;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class LoanApplicationRequest {
    String memberId;
    String cycleId;
    BigDecimal amount;
    int termMonths;
    BorrowingEligibility eligibility;
}
