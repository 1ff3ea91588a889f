package com.coopledger.credit;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.ConfigurationException;
import com.coopledger.common.exception.TierNotAssignedException;
import com.coopledger.cycle.Cycle;
import com.coopledger.cycle.CycleService;
import com.coopledger.ledger.FundKind;
import com.coopledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Resolves a member's borrowing limit and interest rates for a cycle from their tier.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditRatingResolver {

    private final MemberCreditRatingRepository ratingRepository;
    private final BorrowingLimitPolicyRepository policyRepository;
    private final CreditRatingInterestRangeRepository rangeRepository;
    private final CreditRatingService creditRatingService;
    private final CycleService cycleService;
    private final LedgerService ledgerService;

    /**
     * @throws TierNotAssignedException if the member has no tier in the cycle
     * @throws ConfigurationException if the tier has no borrowing limit policy effective by the cycle end
     */
    @Transactional(readOnly = true)
    public BorrowingEligibility resolve(String memberId, String cycleId) {
        Cycle cycle = cycleService.getCycle(cycleId);
        MemberCreditRating rating = ratingRepository.findByMemberIdAndCycleId(memberId, cycleId)
            .orElseThrow(() -> new TierNotAssignedException(memberId, cycleId));
        CreditRatingTier tier = creditRatingService.getTier(rating.getTierId());

        BorrowingLimitPolicy policy = policyRepository
            .findFirstByTierIdAndEffectiveFromLessThanEqualOrderByEffectiveFromDesc(tier.getId(), cycle.getEndDate())
            .orElseThrow(() -> new ConfigurationException(
                "No borrowing limit policy for tier " + tier.getName() + " effective by " + cycle.getEndDate()));

        BigDecimal savings = ledgerService.getMemberBalance(memberId, FundKind.SAVINGS);
        BigDecimal maxLoan = Amounts.normalize(savings.max(BigDecimal.ZERO).multiply(policy.getMultiplier()));
        if (policy.getMaxAmount() != null && maxLoan.compareTo(policy.getMaxAmount()) > 0) {
            maxLoan = Amounts.normalize(policy.getMaxAmount());
        }

        InterestRateSchedule rates = InterestRateSchedule.from(
            rangeRepository.findByTierIdAndCycleId(tier.getId(), cycleId));

        log.debug("Resolved eligibility for member {} in cycle {}: tier={}, savings={}, multiplier={}, max={}",
            memberId, cycleId, tier.getName(), savings, policy.getMultiplier(), maxLoan);

        return BorrowingEligibility.builder()
            .memberId(memberId)
            .cycleId(cycleId)
            .tier(tier)
            .multiplier(policy.getMultiplier())
            .savingsBalance(savings)
            .maxLoanAmount(maxLoan)
            .rates(rates)
            .build();
    }
}
