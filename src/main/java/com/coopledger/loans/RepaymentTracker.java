package com.coopledger.loans;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Records repayments against loans and works out what is still owed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RepaymentTracker {

    private final LoanRepository loanRepository;
    private final RepaymentRepository repaymentRepository;

    @Transactional(readOnly = true)
    public LoanPosition positionOf(Loan loan) {
        RepaymentTotals totals = repaymentRepository.liveTotalsFor(loan.getId());
        if (totals == null) {
            totals = new RepaymentTotals(null, null);
        }
        BigDecimal outstanding = Amounts.normalize(loan.getAmount().subtract(totals.getPrincipal()));
        BigDecimal expectedInterest = loan.expectedInterest();
        boolean repaid = outstanding.compareTo(Amounts.TOLERANCE) <= 0
            && totals.getInterest().compareTo(expectedInterest) >= 0;

        return LoanPosition.builder()
            .loanId(loan.getId())
            .status(loan.getStatus())
            .amount(loan.getAmount())
            .interestRate(loan.getInterestRate())
            .principalPaid(totals.getPrincipal())
            .interestPaid(totals.getInterest())
            .expectedInterest(expectedInterest)
            .outstandingPrincipal(outstanding)
            .fullyRepaid(repaid)
            .build();
    }

    /**
     * The member's most recently disbursed loan that is still open.
     *
     * @throws ValidationException if the member has nothing to repay
     */
    @Transactional(readOnly = true)
    public Loan requireRepayableLoan(String memberId) {
        List<Loan> repayable = loanRepository.findByMemberIdAndStatusIn(memberId, LoanStatus.REPAYABLE);
        return repayable.stream()
            .max(Comparator.comparing(Loan::getDisbursementDate, Comparator.nullsFirst(Comparator.naturalOrder())))
            .orElseThrow(() -> new ValidationException(
                "Member " + memberId + " has no disbursed loan to repay"));
    }

    @Transactional
    public Repayment record(Loan loan, String declarationId, String journalEntryId,
                            BigDecimal principal, BigDecimal interest, LocalDate date) {
        Repayment repayment = repaymentRepository.save(new Repayment(loan, declarationId, journalEntryId,
            Amounts.normalize(principal), Amounts.normalize(interest), date));
        log.info("Recorded repayment {} on loan {}: principal={}, interest={}, entry={}",
            repayment.getId(), loan.getId(), repayment.getPrincipalAmount(), repayment.getInterestAmount(),
            journalEntryId);
        return repayment;
    }
}
