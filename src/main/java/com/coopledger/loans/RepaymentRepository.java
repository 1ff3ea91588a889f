package com.coopledger.loans;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RepaymentRepository extends JpaRepository<Repayment, String> {

    List<Repayment> findByLoanIdOrderByRepaymentDateAsc(String loanId);

    /**
     * Principal and interest repaid on a loan, ignoring repayments whose deposit entry was reversed.
     */
    @Query("select new com.coopledger.loans.RepaymentTotals(sum(r.principalAmount), sum(r.interestAmount)) "
        + "from Repayment r, JournalEntry e "
        + "where r.journalEntryId = e.id and r.loanId = :loanId and e.reversedAt is null")
    RepaymentTotals liveTotalsFor(@Param("loanId") String loanId);
}
