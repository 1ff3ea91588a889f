package com.coopledger.deposits;

import com.coopledger.common.Amounts;
import com.coopledger.common.Months;
import com.coopledger.common.exception.InvalidStateException;
import com.coopledger.common.exception.ValidationException;
import com.coopledger.declarations.Declaration;
import com.coopledger.declarations.DeclarationRepository;
import com.coopledger.declarations.DeclarationService;
import com.coopledger.declarations.DeclaredAmounts;
import com.coopledger.declarations.DepositApproval;
import com.coopledger.declarations.DepositApprovalRepository;
import com.coopledger.declarations.DepositProof;
import com.coopledger.declarations.DepositProofRepository;
import com.coopledger.declarations.DepositProofStatus;
import com.coopledger.ledger.FundKind;
import com.coopledger.ledger.JournalEntry;
import com.coopledger.ledger.JournalEntryRequest;
import com.coopledger.ledger.LedgerService;
import com.coopledger.ledger.OrgAccount;
import com.coopledger.ledger.SourceType;
import com.coopledger.loans.Loan;
import com.coopledger.loans.LoanService;
import com.coopledger.loans.RepaymentTracker;
import com.coopledger.members.Member;
import com.coopledger.members.MemberService;
import com.coopledger.penalties.PenaltyRecord;
import com.coopledger.penalties.PenaltyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import static com.coopledger.ledger.JournalLineRequest.credit;
import static com.coopledger.ledger.JournalLineRequest.debit;

/**
 * Posts an approved deposit proof to the ledger.
 *
 * The declared total is debited to cash and each declared component is credited
 * to the member sub-account or organization account it pays. A proof within a cent
 * of the declared total is accepted, and the entry still balances exactly. Penalties covered by the
 * payment are marked paid and loan components are recorded as repayments. Everything
 * happens in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositApprovalPoster {

    private final DeclarationService declarationService;
    private final DeclarationRepository declarationRepository;
    private final DepositProofRepository proofRepository;
    private final DepositApprovalRepository approvalRepository;
    private final MemberService memberService;
    private final LedgerService ledgerService;
    private final PenaltyService penaltyService;
    private final RepaymentTracker repaymentTracker;
    private final LoanService loanService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @throws InvalidStateException if the proof is already approved or posting is locked for the cycle
     * @throws ValidationException if the proof amount differs from the declared total, or loan
     *                             components are declared without a disbursed loan
     */
    @Transactional
    public DepositApproval approveDeposit(String proofId, String actorId, String notes) {
        DepositProof proof = declarationService.getProof(proofId);
        if (proof.getStatus() == DepositProofStatus.APPROVED || approvalRepository.existsByDepositProofId(proofId)) {
            throw new InvalidStateException("Deposit proof", proofId, DepositProofStatus.APPROVED.name(), "approve");
        }
        Declaration declaration = declarationService.getDeclaration(proof.getDeclarationId());
        ledgerService.assertCycleUnlocked(declaration.getCycleId());

        DeclaredAmounts declared = declaration.amounts().validated();
        if (!Amounts.matches(proof.getAmount(), declared.total())) {
            throw new ValidationException(String.format(
                "Proof amount %s does not match declared total %s", proof.getAmount(), declared.total()));
        }

        Member member = memberService.getMember(declaration.getMemberId());
        Loan loan = declaration.hasLoanComponents()
            ? repaymentTracker.requireRepayableLoan(member.getId())
            : null;

        JournalEntry entry = ledgerService.createJournalEntry(buildEntry(member, declaration, proof, declared, actorId));

        DepositApproval approval = approvalRepository.save(
            new DepositApproval(proof.getId(), entry.getId(), actorId, notes));
        proof.approve(actorId);
        declaration.approve();
        proofRepository.save(proof);
        declarationRepository.save(declaration);

        List<PenaltyRecord> settled = penaltyService.settleFromPayment(
            member.getId(), declared.getPenalties(), entry.getId());

        if (loan != null) {
            repaymentTracker.record(loan, declaration.getId(), entry.getId(),
                declared.getLoanRepayment(), declared.getInterestOnLoan(), LocalDate.now(clock));
            loanService.closeIfRepaid(loan.getId());
        }

        log.info("Approved deposit proof {}: declaration={}, member={}, amount={}, entry={}, penaltiesSettled={}, by={}",
            proofId, declaration.getId(), member.getId(), proof.getAmount(), entry.getId(), settled.size(), actorId);

        eventPublisher.publishEvent(new DepositApprovedEvent(
            member.getId(), declaration.getCycleId(), proof.getId(), entry.getId()));
        return approval;
    }

    private JournalEntryRequest buildEntry(Member member, Declaration declaration, DepositProof proof,
                                           DeclaredAmounts declared, String actorId) {
        String description = "Deposit from " + member.getDisplayName() + " for "
            + Months.label(declaration.getEffectiveMonth());
        JournalEntryRequest.JournalEntryRequestBuilder request = JournalEntryRequest.builder()
            .description(description)
            .cycleId(declaration.getCycleId())
            .sourceType(SourceType.DEPOSIT_APPROVAL)
            .sourceRef(proof.getId())
            .createdBy(actorId)
            .line(debit(ledgerService.requireOrgAccount(OrgAccount.BANK_CASH).getId(), declared.total(),
                "Deposit received"));

        creditMember(request, member, FundKind.SAVINGS, declared.getSavings(), "Savings deposit");
        creditMember(request, member, FundKind.SOCIAL_FUND, declared.getSocialFund(), "Social fund payment");
        creditMember(request, member, FundKind.ADMIN_FUND, declared.getAdminFund(), "Admin fund payment");
        creditMember(request, member, FundKind.PENALTIES_PAYABLE, declared.getPenalties(), "Penalty payment");
        creditOrganization(request, OrgAccount.INTEREST_INCOME, declared.getInterestOnLoan(), "Loan interest");
        creditOrganization(request, OrgAccount.LOANS_RECEIVABLE, declared.getLoanRepayment(), "Loan principal repayment");
        return request.build();
    }

    private void creditMember(JournalEntryRequest.JournalEntryRequestBuilder request, Member member,
                              FundKind fundKind, BigDecimal amount, String description) {
        if (Amounts.isPositive(amount)) {
            String accountId = ledgerService.getOrCreateMemberSubaccount(
                member.getId(), member.getDisplayName(), fundKind).getId();
            request.line(credit(accountId, amount, description));
        }
    }

    private void creditOrganization(JournalEntryRequest.JournalEntryRequestBuilder request, OrgAccount orgAccount,
                                    BigDecimal amount, String description) {
        if (Amounts.isPositive(amount)) {
            request.line(credit(ledgerService.requireOrgAccount(orgAccount).getId(), amount, description));
        }
    }
}
