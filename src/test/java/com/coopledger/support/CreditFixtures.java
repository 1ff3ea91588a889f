package com.coopledger.support;

import com.coopledger.common.Amounts;
import com.coopledger.credit.CreditRatingScheme;
import com.coopledger.credit.CreditRatingService;
import com.coopledger.credit.CreditRatingTier;
import com.coopledger.ledger.FundKind;
import com.coopledger.ledger.JournalEntryRequest;
import com.coopledger.ledger.LedgerAccount;
import com.coopledger.ledger.LedgerService;
import com.coopledger.ledger.OrgAccount;
import com.coopledger.members.Member;

import java.time.LocalDate;

import static com.coopledger.ledger.JournalLineRequest.credit;
import static com.coopledger.ledger.JournalLineRequest.debit;

/**
 * Credit tiers and savings balances for borrowing tests.
 */
public class CreditFixtures {

    private final CreditRatingService creditRatingService;
    private final LedgerService ledgerService;

    public CreditFixtures(CreditRatingService creditRatingService, LedgerService ledgerService) {
        this.creditRatingService = creditRatingService;
        this.ledgerService = ledgerService;
    }

    /**
     * A tier with the given savings multiplier, effective from the start of 2025.
     */
    public CreditRatingTier tier(String name, String multiplier) {
        CreditRatingScheme scheme = creditRatingService.createScheme(name + " scheme", null, LocalDate.of(2025, 1, 1));
        CreditRatingTier tier = creditRatingService.addTier(scheme.getId(), name, 1, null);
        creditRatingService.setBorrowingLimit(tier.getId(), Amounts.of(multiplier), null, LocalDate.of(2025, 1, 1));
        return tier;
    }

    /**
     * Credit the member's savings with an opening balance paid in cash.
     */
    public void seedSavings(Member member, String amount) {
        LedgerAccount cash = ledgerService.requireOrgAccount(OrgAccount.BANK_CASH);
        LedgerAccount savings = ledgerService.getOrCreateMemberSubaccount(
            member.getId(), member.getDisplayName(), FundKind.SAVINGS);
        ledgerService.createJournalEntry(JournalEntryRequest.builder()
            .description("Opening savings for " + member.getDisplayName())
            .sourceRef("opening-" + member.getId())
            .createdBy(CooperativeFixtures.TREASURER)
            .line(debit(cash.getId(), Amounts.of(amount), "Opening balance"))
            .line(credit(savings.getId(), Amounts.of(amount), "Opening balance"))
            .build());
    }
}
