package com.coopledger.rules;

import com.coopledger.common.Amounts;
import com.coopledger.credit.BorrowingEligibility;
import com.coopledger.credit.CreditRatingTier;
import com.coopledger.credit.InterestRateSchedule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the loan application rules and the engine that runs them.
 */
class LoanRulesEngineTest {

    @Test
    void testFirstDeclineWins() {
        LoanApplicationRule approving = mock(LoanApplicationRule.class);
        LoanApplicationRule declining = mock(LoanApplicationRule.class);
        LoanApplicationRule never = mock(LoanApplicationRule.class);
        when(approving.evaluate(any())).thenReturn(RuleResult.approve());
        when(declining.evaluate(any())).thenReturn(RuleResult.decline("Too much"));
        when(declining.getRuleName()).thenReturn("Declining");
        when(approving.getRuleName()).thenReturn("Approving");

        RuleResult result = new LoanRulesEngine(List.of(approving, declining, never))
            .evaluateRules(request("1000.00", 6));

        assertFalse(result.isApproved());
        assertEquals("Too much", result.getReason());
        verifyNoInteractions(never);
    }

    @Test
    void testAllRulesApprove() {
        RuleResult result = new LoanRulesEngine(List.of(new BorrowingLimitRule(), new TermRateRule()))
            .evaluateRules(request("4000.00", 6));

        assertTrue(result.isApproved());
        assertNull(result.getReason());
    }

    @Test
    void testBorrowingLimitRuleDeclinesAboveMax() {
        RuleResult result = new BorrowingLimitRule().evaluate(request("4000.01", 6));

        assertFalse(result.isApproved());
        assertTrue(result.getReason().contains("4000.00"));
    }

    @Test
    void testTermRateRuleUsesAllTermsRate() {
        InterestRateSchedule wildcard = new InterestRateSchedule(Map.of(), Amounts.of("12.00"));

        assertTrue(new TermRateRule().evaluate(request("1000.00", 24, wildcard)).isApproved());
        assertFalse(new TermRateRule().evaluate(request("1000.00", 24)).isApproved());
    }

    private LoanApplicationRequest request(String amount, int termMonths) {
        return request(amount, termMonths, new InterestRateSchedule(Map.of(6, Amounts.of("10.00")), null));
    }

    private LoanApplicationRequest request(String amount, int termMonths, InterestRateSchedule rates) {
        BorrowingEligibility eligibility = BorrowingEligibility.builder()
            .memberId("member-1")
            .cycleId("cycle-1")
            .tier(new CreditRatingTier("scheme-1", "Gold", 1, null))
            .multiplier(new BigDecimal("2.00"))
            .savingsBalance(Amounts.of("2000.00"))
            .maxLoanAmount(Amounts.of("4000.00"))
            .rates(rates)
            .build();
        return LoanApplicationRequest.builder()
            .memberId("member-1")
            .cycleId("cycle-1")
            .amount(Amounts.of(amount))
            .termMonths(termMonths)
            .eligibility(eligibility)
            .build();
    }
}
