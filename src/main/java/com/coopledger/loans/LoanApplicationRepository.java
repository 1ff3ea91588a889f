package com.coopledger.loans;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LoanApplicationRepository extends JpaRepository<LoanApplication, String> {

    boolean existsByMemberIdAndStatus(String memberId, LoanApplicationStatus status);

    List<LoanApplication> findByCycleIdAndStatus(String cycleId, LoanApplicationStatus status);

    List<LoanApplication> findByMemberIdOrderByCreatedAtDesc(String memberId);
}
