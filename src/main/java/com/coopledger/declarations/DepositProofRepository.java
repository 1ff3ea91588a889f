package com.coopledger.declarations;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DepositProofRepository extends JpaRepository<DepositProof, String> {

    Optional<DepositProof> findByDeclarationId(String declarationId);

    List<DepositProof> findByCycleIdAndStatus(String cycleId, DepositProofStatus status);
}
