package com.coopledger.loans;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface LoanRepository extends JpaRepository<Loan, String> {

    List<Loan> findByMemberIdAndStatusIn(String memberId, Collection<LoanStatus> statuses);

    List<Loan> findByStatusIn(Collection<LoanStatus> statuses);

    List<Loan> findByMemberIdOrderByCreatedAtDesc(String memberId);
}
