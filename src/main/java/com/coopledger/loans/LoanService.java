package com.coopledger.loans;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.InvalidStateException;
import com.coopledger.common.exception.NotFoundException;
import com.coopledger.common.exception.ValidationException;
import com.coopledger.credit.BorrowingEligibility;
import com.coopledger.credit.CreditRatingResolver;
import com.coopledger.cycle.Cycle;
import com.coopledger.cycle.CycleService;
import com.coopledger.ledger.JournalEntry;
import com.coopledger.ledger.JournalEntryRequest;
import com.coopledger.ledger.LedgerAccount;
import com.coopledger.ledger.LedgerService;
import com.coopledger.ledger.OrgAccount;
import com.coopledger.ledger.SourceType;
import com.coopledger.members.Member;
import com.coopledger.members.MemberService;
import com.coopledger.penalties.PenaltyAutoApplier;
import com.coopledger.rules.LoanApplicationRequest;
import com.coopledger.rules.LoanRulesEngine;
import com.coopledger.rules.RuleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import static com.coopledger.ledger.JournalLineRequest.credit;
import static com.coopledger.ledger.JournalLineRequest.debit;

/**
 * Service for the loan lifecycle: application, approval, disbursement and closure.
 * Repayments arrive through approved declarations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private final LoanApplicationRepository applicationRepository;
    private final LoanRepository loanRepository;
    private final RepaymentTracker repaymentTracker;
    private final LoanRulesEngine rulesEngine;
    private final CreditRatingResolver creditRatingResolver;
    private final MemberService memberService;
    private final CycleService cycleService;
    private final LedgerService ledgerService;
    private final PenaltyAutoApplier penaltyAutoApplier;
    private final Clock clock;

    /**
     * Submit a loan application after checking it against the member's eligibility.
     *
     * @throws ValidationException if any application rule declines
     */
    @Transactional
    public LoanApplication apply(String memberId, String cycleId, BigDecimal amount, int termMonths,
                                 String notes) {
        Member member = memberService.getActiveMember(memberId);
        Cycle cycle = cycleService.getCycle(cycleId);
        if (!cycle.isActive()) {
            throw new InvalidStateException("Cycle", cycleId, cycle.getStatus().name(), "apply for loan");
        }
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Loan amount must be positive: " + amount);
        }
        if (termMonths < 1) {
            throw new ValidationException("Loan term must be at least one month: " + termMonths);
        }

        BorrowingEligibility eligibility = creditRatingResolver.resolve(memberId, cycleId);
        RuleResult result = rulesEngine.evaluateRules(LoanApplicationRequest.builder()
            .memberId(memberId)
            .cycleId(cycleId)
            .amount(Amounts.normalize(amount))
            .termMonths(termMonths)
            .eligibility(eligibility)
            .build());
        if (!result.isApproved()) {
            throw new ValidationException("Loan application declined: " + result.getReason());
        }

        LoanApplication application = applicationRepository.save(
            new LoanApplication(memberId, cycleId, Amounts.normalize(amount), termMonths, notes));
        log.info("Submitted loan application {}: member={}, amount={}, term={}, limit={}",
            application.getId(), memberId, application.getAmount(), termMonths, eligibility.getMaxLoanAmount());

        penaltyAutoApplier.applyForLoanApplication(member, cycleId);
        return application;
    }

    /**
     * Approve an application at the interest rate its tier offers for the term.
     *
     * @throws com.coopledger.common.exception.ConfigurationException if no rate covers the term
     */
    @Transactional
    public Loan approveApplication(String applicationId, String actorId) {
        LoanApplication application = getApplication(applicationId);
        BorrowingEligibility eligibility = creditRatingResolver.resolve(
            application.getMemberId(), application.getCycleId());
        BigDecimal rate = eligibility.getRates().requireRateFor(application.getTermMonths());

        Loan loan = new Loan(application, rate, actorId);
        application.approve(actorId, loan.getId());
        loanRepository.save(loan);
        applicationRepository.save(application);

        log.info("Approved loan application {}: loan={}, amount={}, rate={}%, by={}",
            applicationId, loan.getId(), loan.getAmount(), rate, actorId);
        return loan;
    }

    @Transactional
    public LoanApplication rejectApplication(String applicationId, String reason, String actorId) {
        LoanApplication application = getApplication(applicationId);
        application.reject(actorId, reason);
        applicationRepository.save(application);
        log.info("Rejected loan application {} by {}: {}", applicationId, actorId, reason);
        return application;
    }

    /**
     * @throws ValidationException if the application belongs to another member
     */
    @Transactional
    public LoanApplication withdrawApplication(String applicationId, String memberId) {
        LoanApplication application = getApplication(applicationId);
        if (!application.getMemberId().equals(memberId)) {
            throw new ValidationException("Loan application " + applicationId + " does not belong to member " + memberId);
        }
        application.withdraw();
        applicationRepository.save(application);
        log.info("Withdrew loan application {} for member {}", applicationId, memberId);
        return application;
    }

    /**
     * Pay out an approved loan: debit loans receivable, credit cash.
     *
     * @throws InvalidStateException if the loan is not approved or posting is locked for its cycle
     */
    @Transactional
    public Loan disburse(String loanId, String actorId) {
        Loan loan = getLoan(loanId);
        if (loan.getStatus() != LoanStatus.APPROVED) {
            throw new InvalidStateException("Loan", loanId, loan.getStatus().name(), "disburse");
        }
        ledgerService.assertCycleUnlocked(loan.getCycleId());

        Member member = memberService.getMember(loan.getMemberId());
        LedgerAccount receivable = ledgerService.requireOrgAccount(OrgAccount.LOANS_RECEIVABLE);
        LedgerAccount cash = ledgerService.requireOrgAccount(OrgAccount.BANK_CASH);
        String description = "Loan disbursement to " + member.getDisplayName();

        JournalEntry entry = ledgerService.createJournalEntry(JournalEntryRequest.builder()
            .description(description)
            .cycleId(loan.getCycleId())
            .sourceType(SourceType.LOAN_DISBURSEMENT)
            .sourceRef(loan.getId())
            .createdBy(actorId)
            .line(debit(receivable.getId(), loan.getAmount(), description))
            .line(credit(cash.getId(), loan.getAmount(), description))
            .build());

        loan.disburse(LocalDate.now(clock), entry.getId(), actorId);
        loanRepository.save(loan);
        log.info("Disbursed loan {}: member={}, amount={}, entry={}, by={}",
            loanId, loan.getMemberId(), loan.getAmount(), entry.getId(), actorId);
        return loan;
    }

    @Transactional(readOnly = true)
    public LoanPosition loanPosition(String loanId) {
        return repaymentTracker.positionOf(getLoan(loanId));
    }

    /**
     * Close the loan once principal is repaid and the expected interest has been paid.
     * Does nothing for loans that are not open or not yet repaid.
     *
     * @return true if the loan was closed by this call
     */
    @Transactional
    public boolean closeIfRepaid(String loanId) {
        Loan loan = getLoan(loanId);
        if (!loan.isRepayable()) {
            log.debug("Loan {} is {}, nothing to close", loanId, loan.getStatus());
            return false;
        }
        LoanPosition position = repaymentTracker.positionOf(loan);
        if (!position.isFullyRepaid()) {
            return false;
        }
        loan.close();
        loanRepository.save(loan);
        log.info("Closed loan {}: principalPaid={}, interestPaid={}, expectedInterest={}",
            loanId, position.getPrincipalPaid(), position.getInterestPaid(), position.getExpectedInterest());
        return true;
    }

    /**
     * Close every open loan that has been repaid.
     *
     * @return the number of loans closed
     */
    @Transactional
    public int closeRepaidLoans() {
        int closed = 0;
        for (Loan loan : loanRepository.findByStatusIn(LoanStatus.REPAYABLE)) {
            if (closeIfRepaid(loan.getId())) {
                closed++;
            }
        }
        return closed;
    }

    @Transactional(readOnly = true)
    public LoanApplication getApplication(String applicationId) {
        return applicationRepository.findById(applicationId)
            .orElseThrow(() -> new NotFoundException("Loan application", applicationId));
    }

    @Transactional(readOnly = true)
    public Loan getLoan(String loanId) {
        return loanRepository.findById(loanId)
            .orElseThrow(() -> new NotFoundException("Loan", loanId));
    }

    @Transactional(readOnly = true)
    public List<Loan> getMemberLoans(String memberId) {
        return loanRepository.findByMemberIdOrderByCreatedAtDesc(memberId);
    }

    @Transactional(readOnly = true)
    public List<LoanApplication> getPendingApplications(String cycleId) {
        return applicationRepository.findByCycleIdAndStatus(cycleId, LoanApplicationStatus.PENDING);
    }
}
