package com.coopledger.funds;

import com.coopledger.common.Amounts;
import com.coopledger.cycle.Cycle;
import com.coopledger.ledger.FundKind;
import com.coopledger.ledger.JournalEntry;
import com.coopledger.ledger.JournalEntryRequest;
import com.coopledger.ledger.LedgerAccount;
import com.coopledger.ledger.LedgerService;
import com.coopledger.ledger.OrgAccount;
import com.coopledger.ledger.SourceType;
import com.coopledger.members.Member;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

import static com.coopledger.ledger.JournalLineRequest.credit;
import static com.coopledger.ledger.JournalLineRequest.debit;

/**
 * Charges a member the cycle's required social and admin fund amounts, once per cycle.
 *
 * The member's fund receivables are debited and the organization funds credited,
 * so later payments net down a known balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InitialRequirementPoster {

    private final LedgerService ledgerService;

    @Transactional
    public Optional<JournalEntry> postIfFirst(Member member, Cycle cycle, String actorId) {
        BigDecimal social = Amounts.normalize(cycle.getSocialFundRequired());
        BigDecimal admin = Amounts.normalize(cycle.getAdminFundRequired());
        if (social.signum() <= 0 && admin.signum() <= 0) {
            return Optional.empty();
        }

        String sourceRef = sourceRef(member.getId(), cycle.getId());
        if (ledgerService.hasLiveEntry(SourceType.CYCLE_INITIAL_REQUIREMENT, sourceRef)) {
            log.debug("Initial requirement already posted for member {} in cycle {}", member.getId(), cycle.getId());
            return Optional.empty();
        }

        String description = "Cycle " + cycle.getYear() + " fund requirement for " + member.getDisplayName();
        JournalEntryRequest.JournalEntryRequestBuilder request = JournalEntryRequest.builder()
            .description(description)
            .cycleId(cycle.getId())
            .sourceType(SourceType.CYCLE_INITIAL_REQUIREMENT)
            .sourceRef(sourceRef)
            .createdBy(actorId);

        if (social.signum() > 0) {
            LedgerAccount memberSocial = ledgerService.getOrCreateMemberSubaccount(
                member.getId(), member.getDisplayName(), FundKind.SOCIAL_FUND);
            LedgerAccount orgSocial = ledgerService.requireOrgAccount(OrgAccount.SOCIAL_FUND);
            request.line(debit(memberSocial.getId(), social, "Social fund required"))
                .line(credit(orgSocial.getId(), social, "Social fund required"));
        }
        if (admin.signum() > 0) {
            LedgerAccount memberAdmin = ledgerService.getOrCreateMemberSubaccount(
                member.getId(), member.getDisplayName(), FundKind.ADMIN_FUND);
            LedgerAccount orgAdmin = ledgerService.requireOrgAccount(OrgAccount.ADMIN_FUND);
            request.line(debit(memberAdmin.getId(), admin, "Admin fund required"))
                .line(credit(orgAdmin.getId(), admin, "Admin fund required"));
        }

        JournalEntry entry = ledgerService.createJournalEntry(request.build());
        log.info("Posted initial fund requirement for member {} in cycle {}: social={}, admin={}, entry={}",
            member.getId(), cycle.getId(), social, admin, entry.getId());
        return Optional.of(entry);
    }

    static String sourceRef(String memberId, String cycleId) {
        return cycleId + ":" + memberId;
    }
}
