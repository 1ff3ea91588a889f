package com.coopledger.credit;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.ConfigurationException;
import com.coopledger.common.exception.TierNotAssignedException;
import com.coopledger.cycle.Cycle;
import com.coopledger.cycle.CycleService;
import com.coopledger.ledger.LedgerService;
import com.coopledger.members.Member;
import com.coopledger.members.MemberService;
import com.coopledger.support.CooperativeFixtures;
import com.coopledger.support.CreditFixtures;
import com.coopledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

import static com.coopledger.support.CooperativeFixtures.TREASURER;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for resolving borrowing limits and interest rates from credit tiers.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestClockConfig.class)
class CreditRatingResolverTest {

    @Autowired
    private CreditRatingResolver resolver;

    @Autowired
    private CreditRatingService creditRatingService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private BorrowingLimitPolicyRepository policyRepository;

    @Autowired
    private MemberService memberService;

    @Autowired
    private CycleService cycleService;

    private CooperativeFixtures fixtures;
    private Member member;
    private Cycle cycle;
    private CreditRatingTier gold;

    @BeforeEach
    void setUp() {
        fixtures = new CooperativeFixtures(memberService, cycleService);
        CreditFixtures credit = new CreditFixtures(creditRatingService, ledgerService);
        member = fixtures.member("Katherine Member");
        cycle = fixtures.activeCycle(2025, null, null);
        gold = credit.tier("Gold", "2.00");
        creditRatingService.assignTier(member.getId(), cycle.getId(), gold.getId(), TREASURER, null);
        credit.seedSavings(member, "2000.00");
    }

    @Test
    void testMaxLoanIsSavingsTimesMultiplier() {
        BorrowingEligibility eligibility = resolver.resolve(member.getId(), cycle.getId());

        assertEquals(gold.getId(), eligibility.getTier().getId());
        assertEquals(0, Amounts.of("2000.00").compareTo(eligibility.getSavingsBalance()));
        assertEquals(0, Amounts.of("2.00").compareTo(eligibility.getMultiplier()));
        assertEquals(0, Amounts.of("4000.00").compareTo(eligibility.getMaxLoanAmount()));
    }

    @Test
    void testCapLimitsMaxLoan() {
        creditRatingService.setBorrowingLimit(gold.getId(), Amounts.of("2.00"), Amounts.of("3000.00"),
            LocalDate.of(2025, 2, 1));

        BorrowingEligibility eligibility = resolver.resolve(member.getId(), cycle.getId());

        assertEquals(0, Amounts.of("3000.00").compareTo(eligibility.getMaxLoanAmount()));
    }

    @Test
    void testPolicyOnSameDateReplacesEarlierOne() {
        // Given the Gold policy effective 2025-01-01 at 2.00
        // When it is set again for the same date
        BorrowingLimitPolicy policy = creditRatingService.setBorrowingLimit(gold.getId(), Amounts.of("3.00"),
            Amounts.of("5000.00"), LocalDate.of(2025, 1, 1));

        // Then there is still one policy and the resolver uses the new values
        assertTrue(policyRepository.findAll().stream()
            .filter(p -> p.getTierId().equals(gold.getId()))
            .allMatch(p -> p.getId().equals(policy.getId())));
        BorrowingEligibility eligibility = resolver.resolve(member.getId(), cycle.getId());
        assertEquals(0, Amounts.of("3.00").compareTo(eligibility.getMultiplier()));
        assertEquals(0, Amounts.of("5000.00").compareTo(eligibility.getMaxLoanAmount()));
    }

    @Test
    void testPolicyEffectiveAfterCycleIsIgnored() {
        creditRatingService.setBorrowingLimit(gold.getId(), Amounts.of("5.00"), null, LocalDate.of(2026, 1, 1));

        BorrowingEligibility eligibility = resolver.resolve(member.getId(), cycle.getId());

        assertEquals(0, Amounts.of("4000.00").compareTo(eligibility.getMaxLoanAmount()));
    }

    @Test
    void testReassignedTierIsUsed() {
        CreditRatingTier silver = new CreditFixtures(creditRatingService, ledgerService).tier("Silver", "1.50");

        creditRatingService.assignTier(member.getId(), cycle.getId(), silver.getId(), TREASURER, "Missed payments");

        assertEquals(0, Amounts.of("3000.00").compareTo(
            resolver.resolve(member.getId(), cycle.getId()).getMaxLoanAmount()));
    }

    @Test
    void testMemberWithoutTierIsNotAssigned() {
        Member newcomer = fixtures.member("New Member");

        TierNotAssignedException e = assertThrows(TierNotAssignedException.class,
            () -> resolver.resolve(newcomer.getId(), cycle.getId()));

        assertEquals(newcomer.getId(), e.getMemberId());
    }

    @Test
    void testTierWithoutPolicyIsConfigurationError() {
        CreditRatingScheme scheme = creditRatingService.createScheme("Bare", null, LocalDate.of(2025, 1, 1));
        CreditRatingTier bare = creditRatingService.addTier(scheme.getId(), "Bare", 1, null);
        creditRatingService.assignTier(member.getId(), cycle.getId(), bare.getId(), TREASURER, null);

        assertThrows(ConfigurationException.class, () -> resolver.resolve(member.getId(), cycle.getId()));
    }

    @Test
    void testExplicitTermRateBeatsAllTermsRate() {
        creditRatingService.setInterestRate(gold.getId(), cycle.getId(), null, Amounts.of("12.00"));
        creditRatingService.setInterestRate(gold.getId(), cycle.getId(), 6, Amounts.of("10.00"));

        InterestRateSchedule rates = resolver.resolve(member.getId(), cycle.getId()).getRates();

        assertEquals(0, Amounts.of("10.00").compareTo(rates.requireRateFor(6)));
        assertEquals(0, Amounts.of("12.00").compareTo(rates.requireRateFor(12)));
    }

    @Test
    void testSettingRateAgainReplacesIt() {
        creditRatingService.setInterestRate(gold.getId(), cycle.getId(), 6, Amounts.of("10.00"));
        creditRatingService.setInterestRate(gold.getId(), cycle.getId(), 6, Amounts.of("8.50"));

        InterestRateSchedule rates = resolver.resolve(member.getId(), cycle.getId()).getRates();

        assertEquals(0, Amounts.of("8.50").compareTo(rates.requireRateFor(6)));
        assertEquals(1, rates.getRatesByTerm().size());
    }

    @Test
    void testTermWithoutRateIsConfigurationError() {
        creditRatingService.setInterestRate(gold.getId(), cycle.getId(), 6, Amounts.of("10.00"));

        InterestRateSchedule rates = resolver.resolve(member.getId(), cycle.getId()).getRates();

        assertTrue(rates.rateFor(12).isEmpty());
        assertThrows(ConfigurationException.class, () -> rates.requireRateFor(12));
    }
}
