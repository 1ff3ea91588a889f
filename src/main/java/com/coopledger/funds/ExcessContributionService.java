package com.coopledger.funds;

import com.coopledger.common.Amounts;
import com.coopledger.cycle.Cycle;
import com.coopledger.cycle.CycleService;
import com.coopledger.ledger.FundKind;
import com.coopledger.ledger.JournalEntry;
import com.coopledger.ledger.JournalEntryRequest;
import com.coopledger.ledger.LedgerAccount;
import com.coopledger.ledger.LedgerService;
import com.coopledger.ledger.SourceType;
import com.coopledger.members.Member;
import com.coopledger.members.MemberService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.coopledger.ledger.JournalLineRequest.credit;
import static com.coopledger.ledger.JournalLineRequest.debit;

/**
 * Moves social and admin fund payments above the cycle's requirement into the member's savings.
 *
 * The excess is what the member paid into a fund in the cycle, less the requirement,
 * less what earlier sweeps already moved, so sweeping again is a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExcessContributionService {

    private final LedgerService ledgerService;
    private final MemberService memberService;
    private final CycleService cycleService;

    /**
     * Sweep in a transaction of its own, so a failure here never touches the caller's work.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<JournalEntry> sweepMemberIndependently(String memberId, String cycleId, String actorId) {
        return sweepMember(memberService.getMember(memberId), cycleService.getCycle(cycleId), actorId);
    }

    @Transactional
    public List<JournalEntry> sweepMember(Member member, Cycle cycle, String actorId) {
        List<JournalEntry> posted = new ArrayList<>();
        sweepFund(member, cycle, FundKind.SOCIAL_FUND, cycle.getSocialFundRequired(), actorId)
            .ifPresent(posted::add);
        sweepFund(member, cycle, FundKind.ADMIN_FUND, cycle.getAdminFundRequired(), actorId)
            .ifPresent(posted::add);
        return posted;
    }

    @Transactional(readOnly = true)
    public BigDecimal excessFor(Member member, Cycle cycle, FundKind fundKind) {
        BigDecimal required = fundKind == FundKind.SOCIAL_FUND
            ? cycle.getSocialFundRequired()
            : cycle.getAdminFundRequired();
        if (required == null) {
            return Amounts.normalize(null);
        }
        return computeExcess(member, cycle, fundKind, required);
    }

    private Optional<JournalEntry> sweepFund(Member member, Cycle cycle, FundKind fundKind,
                                             BigDecimal required, String actorId) {
        if (required == null) {
            return Optional.empty();
        }
        BigDecimal excess = computeExcess(member, cycle, fundKind, required);
        if (excess.compareTo(Amounts.TOLERANCE) < 0) {
            return Optional.empty();
        }

        LedgerAccount fundAccount = ledgerService.getOrCreateMemberSubaccount(
            member.getId(), member.getDisplayName(), fundKind);
        LedgerAccount savings = ledgerService.getOrCreateMemberSubaccount(
            member.getId(), member.getDisplayName(), FundKind.SAVINGS);

        String description = "Excess " + fundKind.getDisplayName() + " contribution moved to savings";
        JournalEntry entry = ledgerService.createJournalEntry(JournalEntryRequest.builder()
            .description(description)
            .cycleId(cycle.getId())
            .sourceType(SourceType.EXCESS_CONTRIBUTION)
            .sourceRef(member.getId())
            .createdBy(actorId)
            .line(debit(fundAccount.getId(), excess, description))
            .line(credit(savings.getId(), excess, description))
            .build());

        log.info("Swept excess {} of {} into savings for member {} in cycle {}: entry={}",
            fundKind, excess, member.getId(), cycle.getId(), entry.getId());
        return Optional.of(entry);
    }

    private BigDecimal computeExcess(Member member, Cycle cycle, FundKind fundKind, BigDecimal required) {
        BigDecimal paid = ledgerService.getMemberFundPayments(member.getId(), fundKind, cycle.getId());
        BigDecimal alreadySwept = ledgerService.findMemberSubaccount(member.getId(), fundKind)
            .map(account -> ledgerService.getLiveTotals(account.getId(), SourceType.EXCESS_CONTRIBUTION,
                cycle.getId()).getDebits())
            .orElse(BigDecimal.ZERO);
        return Amounts.normalize(paid.subtract(Amounts.normalize(required)).subtract(alreadySwept));
    }
}
