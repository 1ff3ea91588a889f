package com.coopledger.declarations;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DepositApprovalRepository extends JpaRepository<DepositApproval, String> {

    Optional<DepositApproval> findByDepositProofId(String depositProofId);

    boolean existsByDepositProofId(String depositProofId);
}
