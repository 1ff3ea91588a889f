package com.coopledger.credit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MemberCreditRatingRepository extends JpaRepository<MemberCreditRating, String> {

    Optional<MemberCreditRating> findByMemberIdAndCycleId(String memberId, String cycleId);
}
