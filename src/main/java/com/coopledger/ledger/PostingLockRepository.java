package com.coopledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PostingLockRepository extends JpaRepository<PostingLock, String> {

    Optional<PostingLock> findByCycleId(String cycleId);

    boolean existsByCycleId(String cycleId);
}
