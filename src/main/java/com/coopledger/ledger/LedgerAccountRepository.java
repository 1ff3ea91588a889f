package com.coopledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ledger accounts.
 */
@Repository
public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, String> {

    Optional<LedgerAccount> findByCode(String code);

    boolean existsByCode(String code);

    Optional<LedgerAccount> findByMemberIdAndFundKind(String memberId, FundKind fundKind);

    List<LedgerAccount> findByMemberId(String memberId);
}
