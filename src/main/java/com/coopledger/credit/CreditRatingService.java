package com.coopledger.credit;

import com.coopledger.common.exception.NotFoundException;
import com.coopledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Maintains credit rating schemes, tiers, borrowing limits, interest rates and member assignments.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditRatingService {

    private final CreditRatingSchemeRepository schemeRepository;
    private final CreditRatingTierRepository tierRepository;
    private final MemberCreditRatingRepository ratingRepository;
    private final BorrowingLimitPolicyRepository policyRepository;
    private final CreditRatingInterestRangeRepository rangeRepository;

    @Transactional
    public CreditRatingScheme createScheme(String name, String description, LocalDate effectiveFrom) {
        CreditRatingScheme scheme = schemeRepository.save(new CreditRatingScheme(name, description, effectiveFrom));
        log.info("Created credit rating scheme {} ({})", scheme.getId(), name);
        return scheme;
    }

    @Transactional
    public CreditRatingTier addTier(String schemeId, String name, int tierOrder, String description) {
        if (!schemeRepository.existsById(schemeId)) {
            throw new NotFoundException("Credit rating scheme", schemeId);
        }
        CreditRatingTier tier = tierRepository.save(new CreditRatingTier(schemeId, name, tierOrder, description));
        log.info("Added tier {} ({}) to scheme {}", tier.getId(), name, schemeId);
        return tier;
    }

    @Transactional(readOnly = true)
    public CreditRatingTier getTier(String tierId) {
        return tierRepository.findById(tierId)
            .orElseThrow(() -> new NotFoundException("Credit rating tier", tierId));
    }

    @Transactional(readOnly = true)
    public List<CreditRatingTier> getTiers(String schemeId) {
        return tierRepository.findBySchemeIdOrderByTierOrderAsc(schemeId);
    }

    /**
     * Replaces the tier's policy that takes effect on the same date, if there is one.
     */
    @Transactional
    public BorrowingLimitPolicy setBorrowingLimit(String tierId, BigDecimal multiplier, BigDecimal maxAmount,
                                                  LocalDate effectiveFrom) {
        getTier(tierId);
        if (multiplier == null || multiplier.signum() < 0) {
            throw new ValidationException("Multiplier must be zero or more: " + multiplier);
        }
        if (effectiveFrom == null) {
            throw new ValidationException("Borrowing limit needs an effective date");
        }
        BorrowingLimitPolicy policy = policyRepository.findByTierIdAndEffectiveFrom(tierId, effectiveFrom)
            .orElseGet(() -> new BorrowingLimitPolicy(tierId, multiplier, maxAmount, effectiveFrom));
        policy.setMultiplier(multiplier);
        policy.setMaxAmount(maxAmount);
        policyRepository.save(policy);
        log.info("Set borrowing limit for tier {}: multiplier={}, cap={}, from {}",
            tierId, multiplier, maxAmount, effectiveFrom);
        return policy;
    }

    /**
     * @param termMonths the term the rate applies to, or null for all terms
     */
    @Transactional
    public CreditRatingInterestRange setInterestRate(String tierId, String cycleId, Integer termMonths,
                                                     BigDecimal interestRate) {
        getTier(tierId);
        if (interestRate == null || interestRate.signum() < 0) {
            throw new ValidationException("Interest rate must be zero or more: " + interestRate);
        }
        CreditRatingInterestRange range = rangeRepository.findByTierIdAndCycleId(tierId, cycleId).stream()
            .filter(existing -> Objects.equals(existing.getTermMonths(), termMonths))
            .findFirst()
            .orElseGet(() -> new CreditRatingInterestRange(tierId, cycleId, termMonths, interestRate));
        range.setInterestRate(interestRate);
        rangeRepository.save(range);
        log.info("Set interest rate for tier {} in cycle {}: term={}, rate={}%",
            tierId, cycleId, termMonths == null ? "all" : termMonths, interestRate);
        return range;
    }

    /**
     * Place a member in a tier for a cycle, replacing any earlier assignment.
     */
    @Transactional
    public MemberCreditRating assignTier(String memberId, String cycleId, String tierId,
                                         String actorId, String notes) {
        getTier(tierId);
        MemberCreditRating rating = ratingRepository.findByMemberIdAndCycleId(memberId, cycleId)
            .orElseGet(() -> new MemberCreditRating(memberId, cycleId));
        rating.assign(tierId, actorId, notes);
        ratingRepository.save(rating);
        log.info("Assigned member {} to tier {} in cycle {} by {}", memberId, tierId, cycleId, actorId);
        return rating;
    }
}
